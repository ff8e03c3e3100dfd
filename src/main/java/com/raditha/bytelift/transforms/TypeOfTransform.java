package com.raditha.bytelift.transforms;

import com.raditha.bytelift.match.Match;
import com.raditha.bytelift.match.MemberPredicate;
import com.raditha.bytelift.match.Pattern;
import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.TypeOf;

import java.util.Optional;

import static com.raditha.bytelift.match.Patterns.call;
import static com.raditha.bytelift.match.Patterns.ldTypeToken;
import static com.raditha.bytelift.match.Patterns.match;

/**
 * {@code call Type::GetTypeFromHandle(ldtoken T)} becomes {@code typeof T}.
 * <p>
 * Must run after {@link InlineParameterDeclarations}, which recognizes the call form.
 */
public class TypeOfTransform implements StatementTransform {

    @Override
    public boolean run(Block block, int pos, TransformContext context) {
        Pattern typeHandleLookup = call(MemberPredicate.is(context.getWellKnownMembers().getTypeFromHandle()),
                ldTypeToken("type"));
        boolean changed = false;
        for (Instruction node : block.getInstructions().get(pos).descendants()) {
            Optional<Match> found = match(typeHandleLookup, node);
            if (found.isPresent()) {
                TypeOf replacement = new TypeOf(found.get().type("type"));
                replacement.setILOffset(node.getILOffset());
                node.replaceWith(replacement);
                changed = true;
            }
        }
        return changed;
    }
}
