package com.raditha.bytelift.model;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered child list owned by a single instruction. Every mutation keeps the parent and slot index
 * of the affected children consistent, and refuses children that are already attached elsewhere.
 */
public final class InstructionCollection extends AbstractList<Instruction> {

    private final Instruction owner;
    private final List<Instruction> items = new ArrayList<>();

    InstructionCollection(Instruction owner) {
        this.owner = owner;
    }

    @Override
    public Instruction get(int index) {
        return items.get(index);
    }

    @Override
    public int size() {
        return items.size();
    }

    /**
     * Replaces the child at {@code index}. The previous child is detached and returned.
     */
    @Override
    public Instruction set(int index, Instruction element) {
        Objects.requireNonNull(element, "element");
        Instruction old = items.get(index);
        if (old == element) {
            return old;
        }
        element.attach(owner, index);
        items.set(index, element);
        old.detach();
        return old;
    }

    @Override
    public void add(int index, Instruction element) {
        Objects.requireNonNull(element, "element");
        element.attach(owner, index);
        items.add(index, element);
        reindexFrom(index + 1);
        modCount++;
    }

    @Override
    public Instruction remove(int index) {
        Instruction removed = items.remove(index);
        removed.detach();
        reindexFrom(index);
        modCount++;
        return removed;
    }

    /**
     * Same as {@link #remove(int)}; named after the tree operation it performs.
     */
    public Instruction removeAt(int index) {
        return remove(index);
    }

    public void insert(int index, Instruction element) {
        add(index, element);
    }

    private void reindexFrom(int start) {
        for (int i = start; i < items.size(); i++) {
            items.get(i).childIndex = i;
        }
    }
}
