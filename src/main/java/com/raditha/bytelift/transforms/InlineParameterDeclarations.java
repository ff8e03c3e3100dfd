package com.raditha.bytelift.transforms;

import com.raditha.bytelift.match.Match;
import com.raditha.bytelift.match.MemberPredicate;
import com.raditha.bytelift.match.Pattern;
import com.raditha.bytelift.match.Patterns;
import com.raditha.bytelift.match.WellKnownMembers;
import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.ILVariable;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.LdLoc;
import com.raditha.bytelift.model.StLoc;
import com.raditha.bytelift.model.TypeReference;
import com.raditha.bytelift.model.VariableKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static com.raditha.bytelift.match.Patterns.call;
import static com.raditha.bytelift.match.Patterns.capture;
import static com.raditha.bytelift.match.Patterns.ldStr;
import static com.raditha.bytelift.match.Patterns.ldTypeToken;
import static com.raditha.bytelift.match.Patterns.stLoc;

/**
 * Inlines the parameter declarations that compilers emit when building expression trees.
 * <pre>
 * stloc v(call Expression::Parameter(call Type::GetTypeFromHandle(ldtoken T), ldstr "name")))
 * </pre>
 * Every {@code ldloc v} in the function is replaced by its own copy of the initializer and the store is
 * removed, even when there were no loads at all.
 * <p>
 * Eligible variables are not parameters, are declared as {@code ParameterExpression} and are written
 * exactly once in the whole function.
 */
public class InlineParameterDeclarations implements StatementTransform {

    private static final Logger logger = LoggerFactory.getLogger(InlineParameterDeclarations.class);

    @Override
    public boolean run(Block block, int pos, TransformContext context) {
        if (!(block.getInstructions().get(pos) instanceof StLoc store)) {
            return false;
        }
        Optional<Match> match = matchParameterVariableAssignment(store, context.getWellKnownMembers());
        if (match.isEmpty()) {
            return false;
        }
        ILVariable v = match.get().variable("v");
        Instruction init = match.get().instruction("init");

        ILFunction function = context.getFunction();
        if (function.storesOf(v).size() != 1) {
            logger.debug("Skipping {} in {}: variable has more than one store", v, function.getName());
            return false;
        }

        List<LdLoc> loads = function.loadsOf(v);
        for (LdLoc load : loads) {
            load.replaceWith(init.cloneSubtree());
        }
        block.getInstructions().removeAt(pos);
        logger.debug("Inlined parameter declaration {} into {} use(s) in {}", v, loads.size(), function.getName());
        return true;
    }

    /**
     * Matches the declaration shape and the variable eligibility rules. Binds {@code v} and {@code init}.
     */
    Optional<Match> matchParameterVariableAssignment(StLoc store, WellKnownMembers members) {
        ILVariable v = store.getVariable();
        if (v.getKind() == VariableKind.PARAMETER) {
            return Optional.empty();
        }
        Optional<TypeReference> parameterExpression = members.parameterExpressionType();
        if (v.getType() == null || parameterExpression.isEmpty() || !parameterExpression.get().equals(v.getType())) {
            return Optional.empty();
        }
        return Patterns.match(declarationPattern(members), store);
    }

    private static Pattern declarationPattern(WellKnownMembers members) {
        Pattern typeArgument = call(MemberPredicate.is(members.getTypeFromHandle()), ldTypeToken("type"));
        return stLoc("v", capture("init",
                call(MemberPredicate.is(members.expressionParameter()), typeArgument, ldStr("name"))));
    }
}
