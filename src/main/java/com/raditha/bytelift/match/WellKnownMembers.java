package com.raditha.bytelift.match;

import com.raditha.bytelift.model.MethodReference;
import com.raditha.bytelift.model.TypeReference;
import com.raditha.bytelift.model.TypeSystemResolver;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Library members the idiom passes recognize, resolved once through the {@link TypeSystemResolver}.
 * A member the resolver does not know stays empty, and every predicate built from it fails.
 */
public class WellKnownMembers {

    public static final String SYSTEM_TYPE = "System.Type";
    public static final String SYSTEM_STRING = "System.String";
    public static final String EXPRESSION = "System.Linq.Expressions.Expression";
    public static final String PARAMETER_EXPRESSION = "System.Linq.Expressions.ParameterExpression";

    private final TypeSystemResolver resolver;
    private final Map<String, Optional<MethodReference>> methods = new ConcurrentHashMap<>();
    private final Map<String, Optional<TypeReference>> types = new ConcurrentHashMap<>();

    public WellKnownMembers(TypeSystemResolver resolver) {
        this.resolver = resolver;
    }

    public Optional<MethodReference> getTypeFromHandle() {
        return method(SYSTEM_TYPE, "GetTypeFromHandle", 1);
    }

    public Optional<MethodReference> expressionParameter() {
        return method(EXPRESSION, "Parameter", 2);
    }

    public Optional<MethodReference> stringConcat(int arity) {
        return method(SYSTEM_STRING, "Concat", arity);
    }

    public Optional<TypeReference> parameterExpressionType() {
        return type(PARAMETER_EXPRESSION);
    }

    public Optional<MethodReference> method(String typeFullName, String name, int arity) {
        String key = typeFullName + "::" + name + "/" + arity;
        return methods.computeIfAbsent(key, k -> resolver == null
                ? Optional.empty()
                : safe(resolver.resolveMethod(typeFullName, name, arity)));
    }

    public Optional<TypeReference> type(String fullName) {
        return types.computeIfAbsent(fullName, k -> resolver == null ? Optional.empty() : safe(resolver.resolveType(fullName)));
    }

    private static <T> Optional<T> safe(Optional<T> value) {
        return value == null ? Optional.empty() : value;
    }
}
