package com.labelsel.labels;

import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.eclipse.collections.impl.set.sorted.mutable.TreeSortedSet;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;

/**
 * Immutable set of label values. Members are kept sorted, so two sets with the same
 * members always iterate in the same order.
 */
public final class StringSet implements Iterable<String> {
    private static final StringSet EMPTY = new StringSet(TreeSortedSet.<String>newSet().toImmutable());

    private final ImmutableSortedSet<String> members;

    private StringSet(ImmutableSortedSet<String> members) {
        this.members = members;
    }

    public static StringSet of(String... values) {
        return from(Arrays.asList(values));
    }

    public static StringSet from(Iterable<String> values) {
        TreeSortedSet<String> sorted = TreeSortedSet.newSet();
        for (String value : values) {
            sorted.add(Objects.requireNonNull(value, "set member"));
        }
        return sorted.isEmpty() ? EMPTY : new StringSet(sorted.toImmutable());
    }

    public boolean contains(String value) {
        return members.contains(value);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public Iterator<String> iterator() {
        return members.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringSet other && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return members.makeString("{", ", ", "}");
    }
}
