package com.raditha.bytelift.workflow;

/**
 * Names one declaration of a loaded module.
 *
 * @param typeName full name of the declaring type (the type itself for {@link MemberKind#TYPE})
 * @param name     member name; equal to the simple type name for types
 * @param kind     what sort of declaration this is
 * @param isStatic whether the member is static
 * @param owner    property or event an accessor belongs to, null for everything else
 */
public record DeclarationRef(String typeName, String name, MemberKind kind, boolean isStatic, String owner) {

    public DeclarationRef {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("typeName cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind.isAccessor() && (owner == null || owner.isBlank())) {
            throw new IllegalArgumentException("accessor " + name + " needs an owner");
        }
    }

    public static DeclarationRef type(String typeName) {
        int dot = typeName.lastIndexOf('.');
        return new DeclarationRef(typeName, typeName.substring(dot + 1), MemberKind.TYPE, false, null);
    }

    public static DeclarationRef method(String typeName, String name) {
        return new DeclarationRef(typeName, name, MemberKind.METHOD, false, null);
    }

    public static DeclarationRef constructor(String typeName) {
        return new DeclarationRef(typeName, ".ctor", MemberKind.CONSTRUCTOR, false, null);
    }

    public static DeclarationRef field(String typeName, String name, boolean isStatic) {
        return new DeclarationRef(typeName, name, MemberKind.FIELD, isStatic, null);
    }

    public static DeclarationRef property(String typeName, String name) {
        return new DeclarationRef(typeName, name, MemberKind.PROPERTY, false, null);
    }

    public static DeclarationRef event(String typeName, String name) {
        return new DeclarationRef(typeName, name, MemberKind.EVENT, false, null);
    }

    public boolean hasBody() {
        return kind.hasBody();
    }

    @Override
    public String toString() {
        return kind == MemberKind.TYPE ? typeName : typeName + "::" + name;
    }
}
