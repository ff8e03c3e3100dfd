package com.raditha.bytelift.match;

import com.raditha.bytelift.model.BinaryNumeric;
import com.raditha.bytelift.model.BinaryOperator;
import com.raditha.bytelift.model.Call;
import com.raditha.bytelift.model.Comp;
import com.raditha.bytelift.model.ComparisonKind;
import com.raditha.bytelift.model.ILVariable;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.LdLoc;
import com.raditha.bytelift.model.LdNull;
import com.raditha.bytelift.model.LdStr;
import com.raditha.bytelift.model.LdTypeToken;
import com.raditha.bytelift.model.LdcI4;
import com.raditha.bytelift.model.LogicNot;
import com.raditha.bytelift.model.MethodReference;
import com.raditha.bytelift.model.NewObj;
import com.raditha.bytelift.model.StLoc;
import com.raditha.bytelift.model.StackType;
import com.raditha.bytelift.model.StringConcat;
import com.raditha.bytelift.model.TypeReference;
import com.raditha.bytelift.model.VariableKind;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static com.raditha.bytelift.match.Patterns.*;
import static org.junit.jupiter.api.Assertions.*;

class PatternsTest {

    private static final MethodReference GET_TYPE = MethodReference.of("System.Type", "GetTypeFromHandle", 1);
    private static final MethodReference SINK = MethodReference.of("Demo.Sink", "Use", 1);

    private final ILVariable v = new ILVariable(VariableKind.LOCAL, TypeReference.of("int32"), "v", 0);
    private final ILVariable w = new ILVariable(VariableKind.LOCAL, TypeReference.of("int32"), "w", 1);

    @Test
    void testStLocBindsVariableAndValue() {
        StLoc store = new StLoc(v, new LdcI4(42));

        Optional<Match> m = match(stLoc("v", capture("value", ldcI4("n"))), store);

        assertTrue(m.isPresent());
        assertSame(v, m.get().variable("v"));
        assertEquals(42, m.get().integer("n"));
        assertSame(store.getValue(), m.get().instruction("value"));
    }

    @Test
    void testRepeatedCaptureNameRequiresSameVariable() {
        Pattern selfUpdate = stLoc("v", binary(BinaryOperator.ADD, ldLoc("v"), any()));

        assertTrue(match(selfUpdate,
                new StLoc(v, new BinaryNumeric(BinaryOperator.ADD, new LdLoc(v), new LdcI4(1)))).isPresent());
        assertTrue(match(selfUpdate,
                new StLoc(v, new BinaryNumeric(BinaryOperator.ADD, new LdLoc(w), new LdcI4(1)))).isEmpty());
        assertTrue(match(selfUpdate,
                new StLoc(v, new BinaryNumeric(BinaryOperator.SUB, new LdLoc(v), new LdcI4(1)))).isEmpty());
    }

    @Test
    void testCallMatchesOnlyResolvedMember() {
        Call lookup = new Call(GET_TYPE, new LdTypeToken(TypeReference.of("int32")));

        Optional<Match> m = match(call(MemberPredicate.is(Optional.of(GET_TYPE)), ldTypeToken("t")), lookup);
        assertTrue(m.isPresent());
        assertEquals(TypeReference.of("int32"), m.get().type("t"));

        assertTrue(match(call(MemberPredicate.is(Optional.empty()), any()), lookup).isEmpty(),
                "an unresolved member must never match");
        assertTrue(match(call(MemberPredicate.is(Optional.of(
                MethodReference.of("Other.Type", "GetTypeFromHandle", 1))), any()), lookup).isEmpty(),
                "a member that only shares the name must not match");
    }

    @Test
    void testCallChecksArgumentCount() {
        Call call = new Call(SINK, new LdcI4(1));

        assertTrue(match(call(MemberPredicate.ANY), call).isEmpty());
        assertTrue(match(call(MemberPredicate.ANY, any(), any()), call).isEmpty());
        assertTrue(match(call(MemberPredicate.ANY, any()), call).isPresent());
    }

    @Test
    void testCallAndNewObjAreDistinct() {
        NewObj ctor = new NewObj(MethodReference.of("Demo.Box", ".ctor", 0));

        assertTrue(match(call(MemberPredicate.ANY), ctor).isEmpty());
        assertTrue(match(newObj(MemberPredicate.ANY), ctor).isPresent());
    }

    @Test
    void testOrDiscardsCapturesOfFailedBranch() {
        Pattern first = capture("x", ldStr()).and(ldcI4(0));
        Pattern second = capture("y", ldStr());

        Optional<Match> m = match(first.or(second), new LdStr("s"));

        assertTrue(m.isPresent());
        assertFalse(m.get().has("x"));
        assertTrue(m.get().has("y"));
    }

    @Test
    void testLogicNotAndConstant() {
        assertTrue(match(logicNot(ldNull()), new LogicNot(new LdNull())).isPresent());
        assertTrue(match(constant(), new LdStr("a")).isPresent());
        assertTrue(match(constant(), new LdLoc(v)).isEmpty());
    }

    @Test
    void testMatchAccessorsReportMissingOrMistypedBindings() {
        Match m = match(ldcI4("n"), new LdcI4(3)).orElseThrow();

        assertThrows(java.util.NoSuchElementException.class, () -> m.variable("missing"));
        assertThrows(ClassCastException.class, () -> m.string("n"));
    }

    @Test
    void testPatternsRejectNull() {
        for (Pattern p : samplePatterns()) {
            assertTrue(match(p, null).isEmpty());
        }
    }

    /**
     * Patterns fail closed: on any tree shape they answer true or false and never throw.
     */
    @Property(tries = 200)
    void patternsNeverThrowOnArbitraryTrees(
            @ForAll @Size(min = 1, max = 30) List<@IntRange(min = 0, max = 9) Integer> shape) {
        Instruction tree = build(shape);
        for (Instruction node : tree.descendants()) {
            for (Pattern p : samplePatterns()) {
                assertDoesNotThrow(() -> match(p, node));
            }
        }
    }

    /**
     * A predicate built from an unresolved member can never match anything.
     */
    @Property(tries = 200)
    void unresolvedMemberNeverMatches(
            @ForAll @Size(min = 1, max = 30) List<@IntRange(min = 0, max = 9) Integer> shape) {
        Pattern unresolved = call(MemberPredicate.is(Optional.empty()), any());
        for (Instruction node : build(shape).descendants()) {
            assertTrue(match(unresolved, node).isEmpty());
        }
    }

    private List<Pattern> samplePatterns() {
        return List.of(
                stLoc("v", capture("init", call(MemberPredicate.ANY, ldTypeToken("t"), ldStr("s")))),
                stLoc("v", binary(null, ldLoc("v"), capture("rhs"))),
                call(MemberPredicate.is(Optional.of(SINK)), ldLoc(v)),
                newObj(MemberPredicate.ANY),
                logicNot(logicNot(any())),
                constant(),
                opCode(com.raditha.bytelift.model.OpCode.COMP).or(ldNull()));
    }

    /**
     * Builds a tree from a list of codes, each either pushing a leaf or combining nodes already built.
     */
    private Instruction build(List<Integer> shape) {
        Deque<Instruction> stack = new ArrayDeque<>();
        for (int code : shape) {
            switch (code) {
                case 0 -> stack.push(new LdcI4(code));
                case 1 -> stack.push(new LdStr("s"));
                case 2 -> stack.push(new LdNull());
                case 3 -> stack.push(new LdLoc(v));
                case 4 -> stack.push(new LogicNot(pop(stack)));
                case 5 -> stack.push(new BinaryNumeric(BinaryOperator.ADD, pop(stack), pop(stack)));
                case 6 -> stack.push(new Call(SINK, pop(stack)));
                case 7 -> stack.push(new StLoc(v, pop(stack)));
                case 8 -> stack.push(new Comp(ComparisonKind.EQ, StackType.I4, pop(stack), pop(stack)));
                default -> {
                    List<Instruction> operands = new ArrayList<>(stack);
                    stack.clear();
                    stack.push(new StringConcat(operands));
                }
            }
        }
        return pop(stack);
    }

    private static Instruction pop(Deque<Instruction> stack) {
        return stack.isEmpty() ? new LdNull() : stack.pop();
    }
}
