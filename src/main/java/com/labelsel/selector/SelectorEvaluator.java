package com.labelsel.selector;

import com.labelsel.labels.Labels;

import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates selector trees against a label source. Stateless and safe to share between
 * threads.
 */
public class SelectorEvaluator {
    public boolean evaluate(SelectorNode node, Labels labels) {
        Objects.requireNonNull(node, "node");

        if (node instanceof SelectorNode.Equals eq) {
            Optional<String> value = labels.get(eq.key());
            return value.isPresent() && value.get().equals(eq.value());
        }

        if (node instanceof SelectorNode.NotEquals ne) {
            // An absent label is "not equal" as well.
            Optional<String> value = labels.get(ne.key());
            return value.isEmpty() || !value.get().equals(ne.value());
        }

        if (node instanceof SelectorNode.In in) {
            Optional<String> value = labels.get(in.key());
            return value.isPresent() && in.values().contains(value.get());
        }

        if (node instanceof SelectorNode.NotIn notIn) {
            Optional<String> value = labels.get(notIn.key());
            return value.isEmpty() || !notIn.values().contains(value.get());
        }

        if (node instanceof SelectorNode.Has has) {
            return labels.get(has.key()).isPresent();
        }

        if (node instanceof SelectorNode.Not not) {
            return !evaluate(not.operand(), labels);
        }

        if (node instanceof SelectorNode.And and) {
            for (SelectorNode operand : and.operands()) {
                if (!evaluate(operand, labels)) {
                    return false;
                }
            }
            return true;
        }

        if (node instanceof SelectorNode.Or or) {
            for (SelectorNode operand : or.operands()) {
                if (evaluate(operand, labels)) {
                    return true;
                }
            }
            return false;
        }

        if (node instanceof SelectorNode.All) {
            return true;
        }

        throw new IllegalArgumentException("Unsupported selector node: " + node.getClass().getName());
    }
}
