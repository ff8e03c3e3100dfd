package com.raditha.bytelift.workflow;

import com.raditha.bytelift.model.ILFunction;

import java.util.List;
import java.util.Optional;

/**
 * Source of method bodies and declaration metadata.
 * <p>
 * Implementations must hand out a fresh tree on every {@link #loadBody(DeclarationRef)} call, since
 * the caller transforms it in place.
 */
public interface Loader {

    /**
     * The initial instruction tree of a method-like declaration, or empty when it has no body.
     */
    Optional<ILFunction> loadBody(DeclarationRef method);

    /**
     * Every member of the type, in declaration order.
     */
    List<DeclarationRef> members(String typeFullName);

    Optional<String> documentation(DeclarationRef member);
}
