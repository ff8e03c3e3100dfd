package com.raditha.bytelift.transforms;

import com.raditha.bytelift.match.MemberPredicate;
import com.raditha.bytelift.match.WellKnownMembers;
import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.CallInstruction;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.OpCode;
import com.raditha.bytelift.model.StringConcat;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@code String::Concat} overloads into a flat {@link StringConcat}, splicing nested
 * concatenations into their parent: {@code Concat(Concat(a, b), c)} becomes {@code concat(a, b, c)}.
 * Nodes are visited bottom-up so inner calls are already flattened when their parent is reached.
 */
public class StringConcatTransform implements StatementTransform {

    private static final int MIN_ARITY = 2;
    private static final int MAX_ARITY = 4;

    @Override
    public boolean run(Block block, int pos, TransformContext context) {
        MemberPredicate concat = concatOverloads(context.getWellKnownMembers());
        List<Instruction> nodes = block.getInstructions().get(pos).descendants();
        boolean changed = false;
        for (int i = nodes.size() - 1; i >= 0; i--) {
            Instruction node = nodes.get(i);
            if (!node.isDescendantOf(block)) {
                continue;
            }
            if (node instanceof CallInstruction call && node.getOpCode() != OpCode.NEW_OBJ
                    && call.getArguments().size() == call.getMethod().parameterCount()
                    && concat.test(call.getMethod())) {
                node.replaceWith(new StringConcat(flatten(node.takeChildren())));
                changed = true;
            } else if (node instanceof StringConcat && hasNestedConcat(node)) {
                node.replaceWith(new StringConcat(flatten(node.takeChildren())));
                changed = true;
            }
        }
        return changed;
    }

    private static MemberPredicate concatOverloads(WellKnownMembers members) {
        MemberPredicate[] overloads = new MemberPredicate[MAX_ARITY - MIN_ARITY + 1];
        for (int arity = MIN_ARITY; arity <= MAX_ARITY; arity++) {
            overloads[arity - MIN_ARITY] = MemberPredicate.is(members.stringConcat(arity));
        }
        return MemberPredicate.anyOf(overloads);
    }

    private static boolean hasNestedConcat(Instruction concat) {
        return concat.getChildren().stream().anyMatch(StringConcat.class::isInstance);
    }

    private static List<Instruction> flatten(List<Instruction> operands) {
        List<Instruction> flat = new ArrayList<>();
        for (Instruction operand : operands) {
            if (operand instanceof StringConcat nested) {
                flat.addAll(nested.takeChildren());
            } else {
                flat.add(operand);
            }
        }
        return flat;
    }
}
