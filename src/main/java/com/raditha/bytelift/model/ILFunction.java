package com.raditha.bytelift.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Root of one method body: an ordered list of {@link Block}s plus the table of variables the body
 * may reference. The first block is the entry point.
 */
public final class ILFunction extends Instruction {

    private final String name;
    private final TypeReference returnType;
    private final List<ILVariable> variables = new ArrayList<>();
    private int temporaryCounter;

    public ILFunction(String name, TypeReference returnType) {
        super(OpCode.FUNCTION);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        this.name = name;
        this.returnType = returnType == null ? TypeReference.VOID : returnType;
    }

    public String getName() {
        return name;
    }

    public TypeReference getReturnType() {
        return returnType;
    }

    public List<Block> getBlocks() {
        List<Block> blocks = new ArrayList<>(children.size());
        for (Instruction child : children) {
            blocks.add((Block) child);
        }
        return blocks;
    }

    public Block getEntryBlock() {
        if (children.isEmpty()) {
            throw new IllegalStateException("Function " + name + " has no blocks");
        }
        return (Block) children.get(0);
    }

    public Block addBlock(Block block) {
        children.add(block);
        return block;
    }

    public List<ILVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    /**
     * Parameters ordered by slot index.
     */
    public List<ILVariable> getParameters() {
        return variables.stream()
                .filter(v -> v.getKind() == VariableKind.PARAMETER)
                .sorted(Comparator.comparingInt(ILVariable::getIndex))
                .toList();
    }

    public ILVariable registerVariable(ILVariable variable) {
        Objects.requireNonNull(variable, "variable");
        if (isRegistered(variable)) {
            throw new IllegalArgumentException("Variable " + variable + " is already registered in " + name);
        }
        variables.add(variable);
        return variable;
    }

    public boolean isRegistered(ILVariable variable) {
        for (ILVariable v : variables) {
            if (v == variable) {
                return true;
            }
        }
        return false;
    }

    /**
     * Mints and registers a fresh compiler temporary. Passes must use this rather than reusing an
     * existing slot.
     */
    public ILVariable registerTemporary(TypeReference type) {
        int index = ++temporaryCounter;
        String tempName = "T_" + index;
        while (hasVariableNamed(tempName)) {
            index = ++temporaryCounter;
            tempName = "T_" + index;
        }
        return registerVariable(new ILVariable(VariableKind.STACK_SLOT, type, tempName, index));
    }

    private boolean hasVariableNamed(String variableName) {
        return variables.stream().anyMatch(v -> v.getName().equals(variableName));
    }

    public List<LdLoc> loadsOf(ILVariable variable) {
        return descendants(LdLoc.class).stream()
                .filter(ld -> ld.getVariable() == variable)
                .toList();
    }

    /**
     * Every instruction that writes {@code variable}: plain stores and compound assignments.
     */
    public List<Instruction> storesOf(ILVariable variable) {
        List<Instruction> stores = new ArrayList<>();
        for (Instruction node : descendants()) {
            if (node instanceof StLoc st && st.getVariable() == variable) {
                stores.add(node);
            } else if (node instanceof CompoundAssignment ca && ca.getVariable() == variable) {
                stores.add(node);
            }
        }
        return stores;
    }

    /**
     * Number of instructions that read or write {@code variable}.
     */
    public int referenceCount(ILVariable variable) {
        int count = 0;
        for (Instruction node : descendants()) {
            if (referencedVariable(node) == variable) {
                count++;
            }
        }
        return count;
    }

    /**
     * Verifies the guarantees the printer relies on: parent links are consistent, every referenced
     * variable is registered here and every branch targets a block of this function.
     *
     * @throws IllegalStateException on the first violation found
     */
    public void checkInvariants() {
        Set<Block> ownBlocks = Collections.newSetFromMap(new IdentityHashMap<>());
        ownBlocks.addAll(getBlocks());
        for (Instruction node : descendants()) {
            for (int i = 0; i < node.getChildCount(); i++) {
                Instruction child = node.getChild(i);
                if (child.getParent() != node || child.getChildIndex() != i) {
                    throw new IllegalStateException("Broken parent link below " + node.getOpCode() + " in " + name);
                }
            }
            ILVariable v = referencedVariable(node);
            if (v != null && !isRegistered(v)) {
                throw new IllegalStateException("Variable " + v + " is not registered in " + name);
            }
            if (node instanceof Branch br && !ownBlocks.contains(br.getTarget())) {
                throw new IllegalStateException("Branch to foreign block " + br.getTarget().getLabel() + " in " + name);
            }
        }
    }

    private static ILVariable referencedVariable(Instruction node) {
        if (node instanceof LdLoc ld) {
            return ld.getVariable();
        }
        if (node instanceof StLoc st) {
            return st.getVariable();
        }
        if (node instanceof CompoundAssignment ca) {
            return ca.getVariable();
        }
        return null;
    }

    /**
     * Deep copy that shares variable identities with this function but gets its own variable table,
     * and whose branches point at the copied blocks.
     */
    @Override
    public ILFunction cloneSubtree() {
        ILFunction copy = (ILFunction) super.cloneSubtree();
        copy.variables.addAll(variables);
        copy.temporaryCounter = temporaryCounter;

        Map<Block, Block> blockMap = new IdentityHashMap<>();
        List<Block> originals = getBlocks();
        List<Block> copies = copy.getBlocks();
        for (int i = 0; i < originals.size(); i++) {
            blockMap.put(originals.get(i), copies.get(i));
        }
        for (Branch branch : copy.descendants(Branch.class)) {
            Block mapped = blockMap.get(branch.getTarget());
            if (mapped != null) {
                branch.setTarget(mapped);
            }
        }
        return copy;
    }

    @Override
    protected Instruction shallowClone() {
        return new ILFunction(name, returnType);
    }

    @Override
    protected boolean operandsEqual(Instruction other) {
        ILFunction that = (ILFunction) other;
        return name.equals(that.name) && returnType.equals(that.returnType);
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
