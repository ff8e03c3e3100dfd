package com.raditha.bytelift.model;

import java.util.List;

/**
 * Formats instruction trees in the textual IL syntax that {@code io.ILReader} accepts.
 * Statements are written one per line; nested instructions are written inline.
 * This is what {@link Instruction#toString()} returns.
 */
public final class ILFormatter implements InstructionVisitor<String> {

    private static final String INDENT = "  ";

    private static final ILFormatter INSTANCE = new ILFormatter();

    private ILFormatter() {
    }

    /**
     * Text of a single node. Functions and blocks come out as multi-line listings.
     */
    public static String toText(Instruction instruction) {
        if (instruction instanceof ILFunction function) {
            return writeFunction(function);
        }
        if (instruction instanceof Block block) {
            StringBuilder sb = new StringBuilder();
            writeBlock(block, sb, "");
            return sb.toString();
        }
        return instruction.accept(INSTANCE) + offsetSuffix(instruction);
    }

    public static String writeFunction(ILFunction function) {
        return writeFunction(function, "");
    }

    /**
     * Listing of a whole function: header, variable table, then its blocks.
     *
     * @param attributes extra header attributes such as {@code kind=ctor static}, written after the name
     */
    public static String writeFunction(ILFunction function, String attributes) {
        StringBuilder sb = new StringBuilder();
        sb.append("method ").append(function.getName());
        if (attributes != null && !attributes.isBlank()) {
            sb.append(' ').append(attributes.strip());
        }
        if (!TypeReference.VOID.equals(function.getReturnType())) {
            sb.append(" returns=").append(function.getReturnType());
        }
        sb.append(" {\n");
        for (ILVariable v : function.getVariables()) {
            sb.append(INDENT);
            if (v.getKind() == VariableKind.PARAMETER) {
                sb.append("param ").append(v.getName()).append(" : ").append(typeName(v));
            } else {
                sb.append("var ").append(v.getName()).append(" : ").append(typeName(v))
                        .append(' ').append(v.getKind().token());
            }
            sb.append('\n');
        }
        for (Block block : function.getBlocks()) {
            writeBlock(block, sb, INDENT);
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static void writeBlock(Block block, StringBuilder sb, String indent) {
        sb.append(indent).append("block ").append(block.getLabel()).append(" {\n");
        for (Instruction statement : block.getInstructions()) {
            sb.append(indent).append(INDENT).append(toText(statement)).append('\n');
        }
        sb.append(indent).append("}\n");
    }

    private static String typeName(ILVariable v) {
        return v.getType() == null ? "?" : v.getType().fullName();
    }

    private static String offsetSuffix(Instruction instruction) {
        return instruction.hasILOffset() ? " @0x" + Integer.toHexString(instruction.getILOffset()) : "";
    }

    private static String args(List<Instruction> children) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(toText(children.get(i)));
        }
        return sb.append(')').toString();
    }

    /**
     * Quotes a string literal, escaping backslash, quote and control characters.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String visitFunction(ILFunction function) {
        return writeFunction(function);
    }

    @Override
    public String visitBlock(Block block) {
        return toText(block);
    }

    @Override
    public String visitLdLoc(LdLoc inst) {
        return "ldloc " + inst.getVariable().getName();
    }

    @Override
    public String visitStLoc(StLoc inst) {
        return "stloc " + inst.getVariable().getName() + args(inst.getChildren());
    }

    @Override
    public String visitCall(CallInstruction inst) {
        String name = switch (inst.getOpCode()) {
            case CALL_VIRT -> "callvirt";
            case NEW_OBJ -> "newobj";
            default -> "call";
        };
        return name + " " + inst.getMethod() + args(inst.getChildren());
    }

    @Override
    public String visitLdcI4(LdcI4 inst) {
        return "ldc.i4 " + inst.getValue();
    }

    @Override
    public String visitLdStr(LdStr inst) {
        return "ldstr " + quote(inst.getValue());
    }

    @Override
    public String visitLdNull(LdNull inst) {
        return "ldnull";
    }

    @Override
    public String visitLdTypeToken(LdTypeToken inst) {
        return "ldtoken " + inst.getType();
    }

    @Override
    public String visitBinaryNumeric(BinaryNumeric inst) {
        return "binary." + inst.getOperator().token() + args(inst.getChildren());
    }

    @Override
    public String visitComp(Comp inst) {
        return "comp." + inst.getKind().token() + "." + inst.getInputType().token() + args(inst.getChildren());
    }

    @Override
    public String visitLogicNot(LogicNot inst) {
        return "logic.not" + args(inst.getChildren());
    }

    @Override
    public String visitIf(IfInstruction inst) {
        if (inst.getChildCount() == 3 && !inst.hasElse()) {
            return "if" + args(inst.getChildren().subList(0, 2));
        }
        return "if" + args(inst.getChildren());
    }

    @Override
    public String visitBranch(Branch inst) {
        return "br " + inst.getTarget().getLabel();
    }

    @Override
    public String visitReturn(Return inst) {
        return inst.getChildCount() == 0 ? "ret" : "ret" + args(inst.getChildren());
    }

    @Override
    public String visitNop(Nop inst) {
        return "nop";
    }

    @Override
    public String visitTypeOf(TypeOf inst) {
        return "typeof " + inst.getType();
    }

    @Override
    public String visitStringConcat(StringConcat inst) {
        return "concat" + args(inst.getChildren());
    }

    @Override
    public String visitCompoundAssignment(CompoundAssignment inst) {
        return "compound." + inst.getOperator().token() + " " + inst.getVariable().getName()
                + args(inst.getChildren());
    }
}
