package com.raditha.bytelift.match;

import com.raditha.bytelift.model.MethodReference;

import java.util.Optional;

/**
 * Identity test for call targets.
 */
@FunctionalInterface
public interface MemberPredicate {

    boolean test(MethodReference method);

    MemberPredicate NEVER = method -> false;

    MemberPredicate ANY = method -> method != null;

    /**
     * Equality against a resolved reference. An unresolved (empty) reference never matches, so a member
     * the type system does not know about can never be mistaken for a well-known one.
     */
    static MemberPredicate is(Optional<MethodReference> resolved) {
        if (resolved.isEmpty()) {
            return NEVER;
        }
        MethodReference expected = resolved.get();
        return expected::equals;
    }

    static MemberPredicate anyOf(MemberPredicate... predicates) {
        return method -> {
            for (MemberPredicate p : predicates) {
                if (p.test(method)) {
                    return true;
                }
            }
            return false;
        };
    }
}
