package com.raditha.bytelift.io;

import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.workflow.DeclarationRef;
import com.raditha.bytelift.workflow.Loader;
import com.raditha.bytelift.workflow.MemberKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Types, members and method bodies read from one IL text file, plus the type system they declare.
 * Every {@link #loadBody(DeclarationRef)} call returns a fresh copy, so callers may transform it freely.
 */
public class ILModule implements Loader {

    private final String sourceName;
    private final InMemoryTypeSystem typeSystem;
    private final Map<String, List<DeclarationRef>> membersByType = new LinkedHashMap<>();
    private final Map<DeclarationRef, ILFunction> bodies = new HashMap<>();
    private final Map<DeclarationRef, String> documentation = new HashMap<>();

    ILModule(String sourceName, InMemoryTypeSystem typeSystem) {
        this.sourceName = sourceName;
        this.typeSystem = typeSystem;
    }

    void addType(String typeName, String doc) {
        membersByType.putIfAbsent(typeName, new ArrayList<>());
        if (doc != null) {
            documentation.put(DeclarationRef.type(typeName), doc);
        }
    }

    void addMember(DeclarationRef member, String doc, ILFunction body) {
        membersByType.computeIfAbsent(member.typeName(), k -> new ArrayList<>()).add(member);
        if (doc != null) {
            documentation.put(member, doc);
        }
        if (body != null) {
            bodies.put(member, body);
        }
    }

    public String getSourceName() {
        return sourceName;
    }

    public InMemoryTypeSystem getTypeSystem() {
        return typeSystem;
    }

    public List<String> getTypeNames() {
        return List.copyOf(membersByType.keySet());
    }

    /**
     * One declaration per type, in file order.
     */
    public List<DeclarationRef> typeDeclarations() {
        return membersByType.keySet().stream().map(DeclarationRef::type).toList();
    }

    /**
     * The declared member matching the type name, member name and kind of {@code ref}.
     */
    public Optional<DeclarationRef> find(DeclarationRef ref) {
        if (ref.kind() == MemberKind.TYPE) {
            return membersByType.containsKey(ref.typeName()) ? Optional.of(ref) : Optional.empty();
        }
        return members(ref.typeName()).stream()
                .filter(m -> m.kind() == ref.kind() && m.name().equals(ref.name()))
                .findFirst();
    }

    @Override
    public Optional<ILFunction> loadBody(DeclarationRef method) {
        return find(method)
                .map(bodies::get)
                .map(ILFunction::cloneSubtree);
    }

    @Override
    public List<DeclarationRef> members(String typeFullName) {
        return Collections.unmodifiableList(membersByType.getOrDefault(typeFullName, List.of()));
    }

    @Override
    public Optional<String> documentation(DeclarationRef member) {
        return find(member).map(documentation::get);
    }
}
