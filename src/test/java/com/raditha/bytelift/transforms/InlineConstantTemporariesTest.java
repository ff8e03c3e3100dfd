package com.raditha.bytelift.transforms;

import com.raditha.bytelift.CancellationToken;
import com.raditha.bytelift.io.ILReader;
import com.raditha.bytelift.io.InMemoryTypeSystem;
import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.ILFunction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InlineConstantTemporariesTest {

    private final InlineConstantTemporaries transform = new InlineConstantTemporaries();

    @Test
    void testFoldsConstantIntoNextStatement() {
        ILFunction function = ILReader.parseFunction("""
                method F {
                  var t : int32 stack
                  block B0 {
                    stloc t(ldc.i4 5)
                    call Demo.Sink::Use/1(ldloc t)
                    ret
                  }
                }
                """);
        Block block = function.getEntryBlock();

        assertTrue(transform.run(block, 0, context(function)));

        assertEquals(2, block.getInstructions().size());
        assertEquals("call Demo.Sink::Use/1(ldc.i4 5)", block.getInstructions().get(0).toString());
        assertEquals(0, function.referenceCount(function.getVariables().get(0)));
    }

    @Test
    void testLocalVariableIsKept() {
        ILFunction function = ILReader.parseFunction("""
                method F {
                  var t : int32 local
                  block B0 {
                    stloc t(ldc.i4 5)
                    call Demo.Sink::Use/1(ldloc t)
                    ret
                  }
                }
                """);

        assertFalse(transform.run(function.getEntryBlock(), 0, context(function)));
    }

    @Test
    void testUseOutsideNextStatementIsKept() {
        ILFunction function = ILReader.parseFunction("""
                method F {
                  var t : int32 stack
                  block B0 {
                    stloc t(ldc.i4 5)
                    nop
                    call Demo.Sink::Use/1(ldloc t)
                    ret
                  }
                }
                """);

        assertFalse(transform.run(function.getEntryBlock(), 0, context(function)));
    }

    @Test
    void testTwoUsesAreKept() {
        ILFunction function = ILReader.parseFunction("""
                method F {
                  var t : int32 stack
                  block B0 {
                    stloc t(ldc.i4 5)
                    call Demo.Sink::Use/2(ldloc t, ldloc t)
                    ret
                  }
                }
                """);

        assertFalse(transform.run(function.getEntryBlock(), 0, context(function)));
    }

    @Test
    void testNonConstantValueIsKept() {
        ILFunction function = ILReader.parseFunction("""
                method F {
                  var t : int32 stack
                  block B0 {
                    stloc t(call Demo.Source::Next/0)
                    call Demo.Sink::Use/1(ldloc t)
                    ret
                  }
                }
                """);

        assertFalse(transform.run(function.getEntryBlock(), 0, context(function)));
    }

    @Test
    void testLastStatementIsIgnored() {
        ILFunction function = ILReader.parseFunction("""
                method F {
                  var t : int32 stack
                  block B0 {
                    stloc t(ldc.i4 5)
                  }
                }
                """);

        assertFalse(transform.run(function.getEntryBlock(), 0, context(function)));
    }

    private static TransformContext context(ILFunction function) {
        return new TransformContext(function, new InMemoryTypeSystem(), CancellationToken.none());
    }
}
