package com.raditha.bytelift.io;

import com.raditha.bytelift.model.MethodReference;
import com.raditha.bytelift.model.TypeReference;
import com.raditha.bytelift.model.TypeSystemResolver;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolver backed by explicitly registered types and methods. Safe for concurrent reads and writes.
 */
public class InMemoryTypeSystem implements TypeSystemResolver {

    private final ConcurrentMap<String, TypeReference> types = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, MethodReference> methods = new ConcurrentHashMap<>();

    public TypeReference registerType(String fullName) {
        return types.computeIfAbsent(fullName, TypeReference::of);
    }

    /**
     * Registers the method and its declaring type.
     */
    public MethodReference registerMethod(MethodReference method) {
        registerType(method.declaringType().fullName());
        MethodReference existing = methods.putIfAbsent(key(method.declaringType().fullName(), method.name(),
                method.parameterCount()), method);
        return existing == null ? method : existing;
    }

    @Override
    public Optional<TypeReference> resolveType(String fullName) {
        return Optional.ofNullable(types.get(fullName));
    }

    @Override
    public Optional<MethodReference> resolveMethod(String typeFullName, String name, int arity) {
        return Optional.ofNullable(methods.get(key(typeFullName, name, arity)));
    }

    public int typeCount() {
        return types.size();
    }

    public int methodCount() {
        return methods.size();
    }

    private static String key(String type, String name, int arity) {
        return type + "::" + name + "/" + arity;
    }
}
