package com.raditha.bytelift.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ILFormatterTest {

    @Test
    void testFunctionListing() {
        ILFunction function = new ILFunction("Pick", TypeReference.of("int32"));
        ILVariable p = function.registerVariable(new ILVariable(VariableKind.PARAMETER, TypeReference.of("int32"), "p", 0));
        ILVariable t = function.registerVariable(new ILVariable(VariableKind.LOCAL, null, "t", 0));
        Block entry = function.addBlock(new Block("B0"));
        entry.getInstructions().add(new StLoc(t, new LdLoc(p)));
        entry.getInstructions().add(new Return(new LdLoc(t)));

        String expected = """
                method Pick returns=int32 {
                  param p : int32
                  var t : ? local
                  block B0 {
                    stloc t(ldloc p)
                    ret(ldloc t)
                  }
                }
                """;
        assertEquals(expected, ILFormatter.writeFunction(function));
        assertEquals(expected, function.toString());
        assertEquals("block B0 {\n  stloc t(ldloc p)\n  ret(ldloc t)\n}\n", entry.toString());
    }

    @Test
    void testNestedOperandsAreInline() {
        MethodReference sink = MethodReference.of("Demo.Sink", "Use", 1);
        Call call = new Call(sink, new BinaryNumeric(BinaryOperator.ADD, new LdcI4(1), new LdcI4(-2)));

        assertEquals("call Demo.Sink::Use/1(binary.add(ldc.i4 1, ldc.i4 -2))", ILFormatter.toText(call));
        assertEquals("logic.not(ldnull)", new LogicNot(new LdNull()).toString());
    }
}
