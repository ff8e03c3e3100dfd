package com.raditha.bytelift.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * A node of the mutable instruction tree.
 * <p>
 * Every node has at most one parent and remembers the slot it occupies there, which makes
 * {@link #replaceWith(Instruction)} a constant-time rebind. Attaching a node that already has a parent
 * fails, so the tree can never contain shared sub-trees; callers that want a second copy must use
 * {@link #cloneSubtree()}.
 */
public abstract class Instruction {

    private final OpCode opCode;
    protected final InstructionCollection children = new InstructionCollection(this);

    private Instruction parent;
    int childIndex = -1;
    private int ilOffset = -1;

    protected Instruction(OpCode opCode) {
        this.opCode = opCode;
    }

    public OpCode getOpCode() {
        return opCode;
    }

    public Instruction getParent() {
        return parent;
    }

    /**
     * Index of this node in its parent's child list, or -1 when detached.
     */
    public int getChildIndex() {
        return childIndex;
    }

    public int getChildCount() {
        return children.size();
    }

    public Instruction getChild(int index) {
        return children.get(index);
    }

    /**
     * Live, read-only view of the children. Use {@link #descendants()} when the tree is about to change.
     */
    public List<Instruction> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getILOffset() {
        return ilOffset;
    }

    public void setILOffset(int ilOffset) {
        this.ilOffset = ilOffset;
    }

    public boolean hasILOffset() {
        return ilOffset >= 0;
    }

    /**
     * Snapshot of this node and all nodes below it, in pre-order. Later mutations do not affect the list.
     */
    public List<Instruction> descendants() {
        List<Instruction> result = new ArrayList<>();
        Deque<Instruction> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Instruction node = stack.pop();
            result.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return result;
    }

    /**
     * Snapshot of all descendants of the given type, in pre-order.
     */
    public <T extends Instruction> List<T> descendants(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Instruction node : descendants()) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }

    /**
     * Parent chain, nearest first. Does not include this node.
     */
    public List<Instruction> ancestors() {
        List<Instruction> result = new ArrayList<>();
        for (Instruction p = parent; p != null; p = p.parent) {
            result.add(p);
        }
        return result;
    }

    public <T extends Instruction> Optional<T> findAncestor(Class<T> type) {
        for (Instruction p = parent; p != null; p = p.parent) {
            if (type.isInstance(p)) {
                return Optional.of(type.cast(p));
            }
        }
        return Optional.empty();
    }

    public boolean isDescendantOf(Instruction other) {
        for (Instruction p = parent; p != null; p = p.parent) {
            if (p == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * Puts {@code replacement} into the slot this node occupies. This node ends up detached.
     * A replacement taken from inside this node's own sub-tree is unhooked first (its old slot gets a
     * {@link Nop}), since that sub-tree is discarded anyway.
     *
     * @throws IllegalStateException if this node has no parent, or the replacement is attached elsewhere
     */
    public void replaceWith(Instruction replacement) {
        if (parent == null) {
            throw new IllegalStateException("Cannot replace a detached " + opCode);
        }
        if (replacement.isDescendantOf(this)) {
            replacement.parent.children.set(replacement.childIndex, new Nop());
        }
        parent.children.set(childIndex, replacement);
    }

    /**
     * Removes this node from its parent's child list.
     */
    public void remove() {
        if (parent == null) {
            throw new IllegalStateException("Cannot remove a detached " + opCode);
        }
        parent.children.remove(childIndex);
    }

    /**
     * Detaches and returns all children, leaving this node empty. Only meant for a node that is about to
     * be discarded, when its operands are moved into a replacement.
     */
    public List<Instruction> takeChildren() {
        List<Instruction> taken = new ArrayList<>(children);
        children.clear();
        return taken;
    }

    /**
     * Deep copy of this sub-tree. Every cloned node is new; operand values and variable references are
     * shared with the original, so the copy loads and stores the same {@link ILVariable} instances.
     * The result is detached.
     */
    public Instruction cloneSubtree() {
        Instruction copy = shallowClone();
        copy.ilOffset = ilOffset;
        for (Instruction child : children) {
            copy.children.add(child.cloneSubtree());
        }
        return copy;
    }

    /**
     * Copy of this node's operands without any children.
     */
    protected abstract Instruction shallowClone();

    /**
     * Compares opcode, operands and children recursively. Variables and members compare by identity and
     * equality respectively; IL offsets are ignored.
     */
    public boolean isStructurallyEqual(Instruction other) {
        if (other == null || other.opCode != opCode || other.children.size() != children.size()) {
            return false;
        }
        if (!operandsEqual(other)) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).isStructurallyEqual(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compares the non-child operands. {@code other} is guaranteed to have the same opcode.
     */
    protected boolean operandsEqual(Instruction other) {
        return true;
    }

    /**
     * True when evaluating this node can neither write state nor throw, so it may be dropped or
     * duplicated freely.
     */
    public boolean isSideEffectFree() {
        return false;
    }

    public abstract <R> R accept(InstructionVisitor<R> visitor);

    void attach(Instruction newParent, int index) {
        if (parent != null) {
            throw new IllegalStateException(opCode + " is already attached to " + parent.opCode
                    + "; clone it before inserting it a second time");
        }
        if (newParent == this || newParent.isDescendantOf(this)) {
            throw new IllegalStateException("Attaching " + opCode + " below itself would create a cycle");
        }
        parent = newParent;
        childIndex = index;
    }

    void detach() {
        parent = null;
        childIndex = -1;
    }

    @Override
    public String toString() {
        return ILFormatter.toText(this);
    }
}
