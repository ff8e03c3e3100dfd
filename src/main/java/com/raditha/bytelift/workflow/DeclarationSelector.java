package com.raditha.bytelift.workflow;

import java.util.List;

/**
 * Decides which method bodies make up a requested declaration.
 * <ul>
 * <li>a type: every member with a body</li>
 * <li>an instance constructor: every instance constructor of the type, so field initializers moved
 * into them can be shown</li>
 * <li>a field: the constructors with the same static-ness, where its initializer lives</li>
 * <li>a property or event: its accessors</li>
 * <li>anything else with a body: just that body</li>
 * </ul>
 */
public class DeclarationSelector {

    private final Loader loader;

    public DeclarationSelector(Loader loader) {
        this.loader = loader;
    }

    public List<DeclarationRef> select(DeclarationRef declaration) {
        return switch (declaration.kind()) {
            case TYPE -> loader.members(declaration.typeName()).stream()
                    .filter(DeclarationRef::hasBody)
                    .toList();
            case CONSTRUCTOR -> {
                List<DeclarationRef> constructors = membersOf(declaration, MemberKind.CONSTRUCTOR);
                yield constructors.isEmpty() ? List.of(declaration) : constructors;
            }
            case FIELD -> membersOf(declaration,
                    declaration.isStatic() ? MemberKind.STATIC_CONSTRUCTOR : MemberKind.CONSTRUCTOR);
            case PROPERTY -> accessorsOf(declaration, MemberKind.GETTER, MemberKind.SETTER);
            case EVENT -> accessorsOf(declaration, MemberKind.ADDER, MemberKind.REMOVER);
            default -> List.of(declaration);
        };
    }

    private List<DeclarationRef> membersOf(DeclarationRef declaration, MemberKind kind) {
        return loader.members(declaration.typeName()).stream()
                .filter(m -> m.kind() == kind)
                .toList();
    }

    private List<DeclarationRef> accessorsOf(DeclarationRef declaration, MemberKind first, MemberKind second) {
        return loader.members(declaration.typeName()).stream()
                .filter(m -> m.kind() == first || m.kind() == second)
                .filter(m -> declaration.name().equals(m.owner()))
                .toList();
    }
}
