package com.raditha.bytelift.model;

import java.util.Optional;

/**
 * Read-only view of the loaded type system. Implementations must tolerate concurrent queries.
 * An unknown type or member is reported as {@link Optional#empty()}, never as an exception.
 */
public interface TypeSystemResolver {

    Optional<TypeReference> resolveType(String fullName);

    Optional<MethodReference> resolveMethod(String typeFullName, String name, int arity);
}
