package com.raditha.bytelift.pipeline;

import com.raditha.bytelift.CancellationToken;
import com.raditha.bytelift.DecompilationCancelledException;
import com.raditha.bytelift.Fixtures;
import com.raditha.bytelift.config.DecompilerSettings;
import com.raditha.bytelift.io.ILModule;
import com.raditha.bytelift.io.ILReader;
import com.raditha.bytelift.io.InMemoryTypeSystem;
import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.Nop;
import com.raditha.bytelift.model.OpCode;
import com.raditha.bytelift.transforms.FunctionTransform;
import com.raditha.bytelift.transforms.StatementTransform;
import com.raditha.bytelift.transforms.Transform;
import com.raditha.bytelift.transforms.TransformContext;
import com.raditha.bytelift.workflow.DeclarationRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

class TransformPipelineTest {

    private static final String SIMPLE = """
            method F {
              var x : int32 local
              block B0 {
                stloc x(ldc.i4 1)
                stloc x(ldc.i4 2)
                stloc x(ldc.i4 3)
                ret
              }
            }
            """;

    /** Inserts a nop at the start of the entry block. */
    static class AddNop implements FunctionTransform {
        @Override
        public boolean run(ILFunction function, TransformContext context) {
            function.getEntryBlock().getInstructions().add(0, new Nop());
            return true;
        }
    }

    /** Removes a leading nop, undoing {@link AddNop}. */
    static class DropNop implements FunctionTransform {
        @Override
        public boolean run(ILFunction function, TransformContext context) {
            if (function.getEntryBlock().getInstructions().get(0).getOpCode() != OpCode.NOP) {
                return false;
            }
            function.getEntryBlock().getInstructions().removeAt(0);
            return true;
        }
    }

    /** Claims a change at every position without ever changing anything. */
    static class AlwaysChanges implements StatementTransform {
        @Override
        public boolean run(Block block, int pos, TransformContext context) {
            return true;
        }
    }

    /** Deletes stores one at a time. */
    static class DeleteStores implements StatementTransform {
        @Override
        public boolean run(Block block, int pos, TransformContext context) {
            if (block.getInstructions().get(pos).getOpCode() != OpCode.ST_LOC) {
                return false;
            }
            block.getInstructions().removeAt(pos);
            return true;
        }
    }

    static class Throws implements FunctionTransform {
        @Override
        public boolean run(ILFunction function, TransformContext context) {
            throw new IllegalStateException("boom");
        }
    }

    static class NoOp implements FunctionTransform {
        @Override
        public boolean run(ILFunction function, TransformContext context) {
            return false;
        }
    }

    @Test
    void testDefaultPipelineSettlesOnStep() {
        ILModule module = Fixtures.module("members.il");
        ILFunction step = module.loadBody(DeclarationRef.method("Demo.Counter", "Step")).orElseThrow();
        TransformPipeline pipeline = TransformPipeline.createDefault(DecompilerSettings.defaults());

        PipelineRun run = pipeline.run(step, context(step, module.getTypeSystem(), CancellationToken.none()));

        assertEquals(PipelineRun.Outcome.SETTLED, run.outcome());
        assertEquals(2, run.cycles());
        assertEquals(List.of(
                "stloc total(ldc.i4 0)",
                "compound.add total(ldc.i4 5)",
                "if(comp.ge.i4(ldloc n, ldc.i4 0), br B1)",
                "ret(ldloc total)"), statements(step.getEntryBlock()));
        assertEquals(1, run.changesOf("InlineConstantTemporaries"));
        assertEquals(1, run.changesOf("LogicNotSimplification"));
        assertEquals(1, run.changesOf("CompoundAssignmentTransform"));
        assertEquals(1, run.changesOf("RemoveNopsTransform"));
        assertEquals(4, run.totalChanges());
        assertEquals(8, run.appliedPasses().size());
        assertDoesNotThrow(step::checkInvariants);
    }

    @Test
    void testRunningTwiceChangesNothing() {
        ILModule module = Fixtures.module("members.il");
        ILFunction step = module.loadBody(DeclarationRef.method("Demo.Counter", "Step")).orElseThrow();
        TransformPipeline pipeline = TransformPipeline.createDefault(DecompilerSettings.defaults());
        pipeline.run(step, context(step, module.getTypeSystem(), CancellationToken.none()));
        String settled = step.toString();

        PipelineRun again = pipeline.run(step, context(step, module.getTypeSystem(), CancellationToken.none()));

        assertEquals(1, again.cycles());
        assertEquals(0, again.totalChanges());
        assertEquals(settled, step.toString());
    }

    @Test
    void testAbortAfterStopsInFirstCycle() {
        ILModule module = Fixtures.module("members.il");
        ILFunction step = module.loadBody(DeclarationRef.method("Demo.Counter", "Step")).orElseThrow();
        TransformPipeline pipeline = TransformPipeline.createDefault(
                DecompilerSettings.defaults().withAbortAfter("InlineConstantTemporaries"));

        PipelineRun run = pipeline.run(step, context(step, module.getTypeSystem(), CancellationToken.none()));

        assertEquals(PipelineRun.Outcome.ABORTED, run.outcome());
        assertEquals(List.of("InlineParameterDeclarations", "InlineConstantTemporaries"), run.appliedPasses());
        assertEquals(1, run.cycles());
        assertTrue(statements(step.getEntryBlock()).contains("nop"), "later passes did not run");
    }

    @Test
    void testDisabledTransformsAreLeftOut() {
        TransformPipeline pipeline = TransformPipeline.createDefault(
                DecompilerSettings.defaults().withDisabled(List.of("RemoveNopsTransform", "TypeOfTransform")));

        List<String> names = pipeline.getTransforms().stream().map(Transform::name).toList();
        assertEquals(6, names.size());
        assertFalse(names.contains("RemoveNopsTransform"));
        assertFalse(names.contains("TypeOfTransform"));
    }

    @Test
    void testOscillatingPairHitsCycleBound() {
        ILFunction function = ILReader.parseFunction(SIMPLE);
        TransformPipeline pipeline = new TransformPipeline(List.of(new AddNop(), new DropNop()), 4, 3, null);

        PassFaultException ex = assertThrows(PassFaultException.class,
                () -> pipeline.run(function, context(function)));
        assertTrue(ex.getMessage().contains("did not converge after 3 cycles"));
        assertEquals("DropNop", ex.getPassName());
    }

    @Test
    void testStatementTransformThatNeverSettlesHitsRetryBound() {
        ILFunction function = ILReader.parseFunction(SIMPLE);
        TransformPipeline pipeline = new TransformPipeline(List.of(new AlwaysChanges()), 5, 8, null);

        PassFaultException ex = assertThrows(PassFaultException.class,
                () -> pipeline.run(function, context(function)));
        assertEquals("AlwaysChanges", ex.getPassName());
        assertTrue(ex.getMessage().contains("kept changing position 0 of block B0"));
    }

    @Test
    void testShrinkingBlockResetsRetries() {
        ILFunction function = ILReader.parseFunction(SIMPLE);
        TransformPipeline pipeline = new TransformPipeline(List.of(new DeleteStores()), 1, 8, null);

        PipelineRun run = pipeline.run(function, context(function));

        assertEquals(PipelineRun.Outcome.SETTLED, run.outcome());
        assertEquals(List.of("ret"), statements(function.getEntryBlock()));
        assertEquals(2, run.cycles());
    }

    @Test
    void testThrowingTransformBecomesPassFault() {
        ILFunction function = ILReader.parseFunction(SIMPLE);
        TransformPipeline pipeline = new TransformPipeline(List.of(new NoOp(), new Throws()), 4, 4, null);

        PassFaultException ex = assertThrows(PassFaultException.class,
                () -> pipeline.run(function, context(function)));
        assertEquals("Throws", ex.getPassName());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertTrue(ex.getMessage().contains("boom"));
    }

    @Test
    void testCancelledTokenStopsBeforeFirstPass() {
        ILFunction function = ILReader.parseFunction(SIMPLE);
        FunctionTransform transform = mock(FunctionTransform.class);
        TransformPipeline pipeline = new TransformPipeline(List.of(transform), 4, 4, null);
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(DecompilationCancelledException.class,
                () -> pipeline.run(function, context(function, new InMemoryTypeSystem(), token)));
        verifyNoInteractions(transform);
    }

    @Test
    void testCancellationBetweenPasses() {
        ILFunction function = ILReader.parseFunction(SIMPLE);
        CancellationToken token = new CancellationToken();
        FunctionTransform cancelling = new FunctionTransform() {
            @Override
            public boolean run(ILFunction f, TransformContext context) {
                token.cancel();
                return true;
            }
        };
        FunctionTransform never = mock(FunctionTransform.class);
        TransformPipeline pipeline = new TransformPipeline(List.of(cancelling, never), 4, 4, null);

        assertThrows(DecompilationCancelledException.class,
                () -> pipeline.run(function, context(function, new InMemoryTypeSystem(), token)));
        verifyNoInteractions(never);
    }

    @Test
    void testListenerSeesEveryPass() {
        ILFunction function = ILReader.parseFunction(SIMPLE);
        NoOp noOp = new NoOp();
        TransformPipeline pipeline = new TransformPipeline(List.of(noOp), 4, 4, null);
        PipelineListener listener = mock(PipelineListener.class);
        pipeline.addListener(listener);

        pipeline.run(function, context(function));

        verify(listener).beforePass(same(noOp), same(function));
        verify(listener).afterPass(same(noOp), same(function), eq(false));

        pipeline.removeListener(listener);
        pipeline.run(function, context(function));
        verifyNoMoreInteractions(listener);
    }

    @Test
    void testStatementTransformsRunBeforeFunctionTransforms() {
        ILFunction function = ILReader.parseFunction(SIMPLE);
        NoOp functionPass = new NoOp();
        DeleteStores statementPass = new DeleteStores();
        TransformPipeline pipeline = new TransformPipeline(List.of(functionPass, statementPass), 4, 4, null);

        PipelineRun run = pipeline.run(function, context(function));

        assertEquals(List.of("DeleteStores", "NoOp"), run.appliedPasses());
    }

    @Test
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TransformPipeline(List.of(), 0, 4, null));
        assertThrows(IllegalArgumentException.class, () -> new TransformPipeline(List.of(), 4, 0, null));
        assertThrows(IllegalArgumentException.class, () -> new TransformPipeline(List.of(new Transform() {
        }), 4, 4, null));
    }

    private static TransformContext context(ILFunction function) {
        return context(function, new InMemoryTypeSystem(), CancellationToken.none());
    }

    private static TransformContext context(ILFunction function, InMemoryTypeSystem typeSystem,
            CancellationToken token) {
        return new TransformContext(function, typeSystem, token);
    }

    private static List<String> statements(Block block) {
        return block.getInstructions().stream().map(Object::toString).toList();
    }
}
