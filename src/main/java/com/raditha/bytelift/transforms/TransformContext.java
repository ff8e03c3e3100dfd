package com.raditha.bytelift.transforms;

import com.raditha.bytelift.CancellationToken;
import com.raditha.bytelift.match.WellKnownMembers;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.TypeSystemResolver;

import java.util.Objects;

/**
 * Everything a transform may consult besides the block it is handed. Scoped to one function, so the
 * only state shared with other decompilations is the read-only resolver.
 */
public class TransformContext {

    private final ILFunction function;
    private final TypeSystemResolver resolver;
    private final WellKnownMembers wellKnownMembers;
    private final CancellationToken cancellationToken;

    public TransformContext(ILFunction function, TypeSystemResolver resolver, CancellationToken cancellationToken) {
        this(function, resolver, new WellKnownMembers(resolver), cancellationToken);
    }

    public TransformContext(ILFunction function, TypeSystemResolver resolver, WellKnownMembers wellKnownMembers,
            CancellationToken cancellationToken) {
        this.function = Objects.requireNonNull(function, "function");
        this.resolver = resolver;
        this.wellKnownMembers = Objects.requireNonNull(wellKnownMembers, "wellKnownMembers");
        this.cancellationToken = cancellationToken == null ? CancellationToken.none() : cancellationToken;
    }

    /**
     * The function being transformed. Transforms must not look outside it.
     */
    public ILFunction getFunction() {
        return function;
    }

    public TypeSystemResolver getResolver() {
        return resolver;
    }

    public WellKnownMembers getWellKnownMembers() {
        return wellKnownMembers;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }
}
