package com.raditha.bytelift.transforms;

import java.util.List;

/**
 * The registered transforms in their default order. Order matters where one transform matches the
 * shape another one simplifies away.
 */
public final class TransformRegistry {

    private TransformRegistry() {
        /* this is only a utility class */
    }

    /**
     * Fresh instances of every transform, in pipeline order.
     */
    public static List<Transform> createAll() {
        return List.of(
                new InlineParameterDeclarations(),
                new InlineConstantTemporaries(),
                new TypeOfTransform(),
                new StringConcatTransform(),
                new LogicNotSimplification(),
                new CompoundAssignmentTransform(),
                new RemoveNopsTransform(),
                new DeadTemporaryStoreElimination());
    }

    public static List<String> names() {
        return createAll().stream().map(Transform::name).toList();
    }

    public static boolean isKnown(String name) {
        return names().contains(name);
    }
}
