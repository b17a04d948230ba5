package com.labelsel.output;

import com.labelsel.labels.StringSet;
import com.labelsel.selector.SelectorNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Renders selector trees in their canonical text form. The output is re-parseable and
 * deterministic: the same tree always produces the same string, which is what unique
 * IDs are derived from.
 */
public class CanonicalFormatter {

    public String format(SelectorNode node) {
        return collectFragments(node, Lists.mutable.empty()).makeString("");
    }

    /**
     * Appends the fragments rendering {@code node} (and its children) to {@code fragments}.
     *
     * @return the same list, for chaining
     */
    public MutableList<String> collectFragments(SelectorNode node, MutableList<String> fragments) {
        Objects.requireNonNull(node, "node");

        if (node instanceof SelectorNode.Equals eq) {
            return fragments.with(eq.key()).with(" == ").with(quote(eq.value()));
        }
        if (node instanceof SelectorNode.NotEquals ne) {
            return fragments.with(ne.key()).with(" != ").with(quote(ne.value()));
        }
        if (node instanceof SelectorNode.In in) {
            return collectSetFragments(fragments, in.key(), "in", in.values());
        }
        if (node instanceof SelectorNode.NotIn notIn) {
            return collectSetFragments(fragments, notIn.key(), "not in", notIn.values());
        }
        if (node instanceof SelectorNode.Has has) {
            return fragments.with("has(").with(has.key()).with(")");
        }
        if (node instanceof SelectorNode.Not not) {
            fragments.add("!");
            return collectFragments(not.operand(), fragments);
        }
        if (node instanceof SelectorNode.And and) {
            return collectJoinedFragments(fragments, " && ", and.operands());
        }
        if (node instanceof SelectorNode.Or or) {
            return collectJoinedFragments(fragments, " || ", or.operands());
        }
        if (node instanceof SelectorNode.All) {
            return fragments.with("all()");
        }

        throw new IllegalArgumentException("Unsupported selector node: " + node.getClass().getName());
    }

    private MutableList<String> collectSetFragments(MutableList<String> fragments, String key, String op, StringSet values) {
        fragments.add(key);
        fragments.add(" " + op + " {");
        boolean first = true;
        for (String value : values) {
            if (!first) {
                fragments.add(", ");
            }
            first = false;
            fragments.add(quote(value));
        }
        fragments.add("}");
        return fragments;
    }

    private MutableList<String> collectJoinedFragments(MutableList<String> fragments, String separator,
                                                       Iterable<SelectorNode> operands) {
        fragments.add("(");
        boolean first = true;
        for (SelectorNode operand : operands) {
            if (!first) {
                fragments.add(separator);
            }
            first = false;
            collectFragments(operand, fragments);
        }
        fragments.add(")");
        return fragments;
    }

    /**
     * Wraps a value in double quotes, or single quotes when it contains a double quote.
     * No escaping is applied, so a value holding both quote characters does not round-trip.
     */
    static String quote(String value) {
        String quote = value.indexOf('"') >= 0 ? "'" : "\"";
        return quote + value + quote;
    }
}
