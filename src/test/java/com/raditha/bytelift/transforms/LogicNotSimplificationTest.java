package com.raditha.bytelift.transforms;

import com.raditha.bytelift.CancellationToken;
import com.raditha.bytelift.io.ILReader;
import com.raditha.bytelift.io.InMemoryTypeSystem;
import com.raditha.bytelift.model.ILFunction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogicNotSimplificationTest {

    private final LogicNotSimplification transform = new LogicNotSimplification();

    @Test
    void testDoubleNegationCancels() {
        ILFunction function = parse("ret(logic.not(logic.not(ldloc b)))");

        assertTrue(transform.run(function.getEntryBlock(), 0, context(function)));
        assertEquals("ret(ldloc b)", statement(function));
    }

    @Test
    void testTripleNegationLeavesOne() {
        ILFunction function = parse("ret(logic.not(logic.not(logic.not(ldloc b))))");

        assertTrue(transform.run(function.getEntryBlock(), 0, context(function)));
        assertEquals("ret(logic.not(ldloc b))", statement(function));
    }

    @Test
    void testNegatedIntegerComparisonFlips() {
        ILFunction function = parse("if(logic.not(comp.lt.i4(ldloc n, ldc.i4 0)) @0x8, ret)");

        assertTrue(transform.run(function.getEntryBlock(), 0, context(function)));
        assertEquals("if(comp.ge.i4(ldloc n, ldc.i4 0) @0x8, ret)", statement(function));
    }

    @Test
    void testNegatedFloatComparisonIsKept() {
        ILFunction function = parse("ret(logic.not(comp.lt.f(ldloc n, ldc.i4 0)))");

        assertFalse(transform.run(function.getEntryBlock(), 0, context(function)));
        assertEquals("ret(logic.not(comp.lt.f(ldloc n, ldc.i4 0)))", statement(function));
    }

    @Test
    void testPlainNegationIsKept() {
        ILFunction function = parse("ret(logic.not(ldloc b))");

        assertFalse(transform.run(function.getEntryBlock(), 0, context(function)));
    }

    private static ILFunction parse(String statement) {
        return ILReader.parseFunction("""
                method F returns=bool {
                  param b : bool
                  param n : int32
                  block B0 {
                    %s
                  }
                }
                """.formatted(statement));
    }

    private static String statement(ILFunction function) {
        return function.getEntryBlock().getInstructions().get(0).toString();
    }

    private static TransformContext context(ILFunction function) {
        return new TransformContext(function, new InMemoryTypeSystem(), CancellationToken.none());
    }
}
