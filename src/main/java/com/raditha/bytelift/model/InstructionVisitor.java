package com.raditha.bytelift.model;

/**
 * Double-dispatch over the concrete instruction types.
 *
 * @param <R> result type
 */
public interface InstructionVisitor<R> {

    R visitFunction(ILFunction function);

    R visitBlock(Block block);

    R visitLdLoc(LdLoc inst);

    R visitStLoc(StLoc inst);

    R visitCall(CallInstruction inst);

    R visitLdcI4(LdcI4 inst);

    R visitLdStr(LdStr inst);

    R visitLdNull(LdNull inst);

    R visitLdTypeToken(LdTypeToken inst);

    R visitBinaryNumeric(BinaryNumeric inst);

    R visitComp(Comp inst);

    R visitLogicNot(LogicNot inst);

    R visitIf(IfInstruction inst);

    R visitBranch(Branch inst);

    R visitReturn(Return inst);

    R visitNop(Nop inst);

    R visitTypeOf(TypeOf inst);

    R visitStringConcat(StringConcat inst);

    R visitCompoundAssignment(CompoundAssignment inst);
}
