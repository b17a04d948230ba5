package com.labelsel.selector;

import com.labelsel.labels.StringSet;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable expression tree of a label selector. Trees are built by a parser upstream
 * (or by the static factories below) and never change afterwards.
 */
public sealed interface SelectorNode {
    record Equals(String key, String value) implements SelectorNode {
        public Equals {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    record NotEquals(String key, String value) implements SelectorNode {
        public NotEquals {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    record In(String key, StringSet values) implements SelectorNode {
        public In {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(values, "values");
        }
    }

    record NotIn(String key, StringSet values) implements SelectorNode {
        public NotIn {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(values, "values");
        }
    }

    record Has(String key) implements SelectorNode {
        public Has {
            Objects.requireNonNull(key, "key");
        }
    }

    record Not(SelectorNode operand) implements SelectorNode {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record And(ImmutableList<SelectorNode> operands) implements SelectorNode {
        public And {
            operands = checkOperands("and", operands);
        }
    }

    record Or(ImmutableList<SelectorNode> operands) implements SelectorNode {
        public Or {
            operands = checkOperands("or", operands);
        }
    }

    record All() implements SelectorNode {}

    static Equals eq(String key, String value) {
        return new Equals(key, value);
    }

    static NotEquals ne(String key, String value) {
        return new NotEquals(key, value);
    }

    static In in(String key, String... values) {
        return new In(key, StringSet.of(values));
    }

    static NotIn notIn(String key, String... values) {
        return new NotIn(key, StringSet.of(values));
    }

    static Has has(String key) {
        return new Has(key);
    }

    static Not not(SelectorNode operand) {
        return new Not(operand);
    }

    static And and(SelectorNode... operands) {
        return new And(Lists.immutable.withAll(Arrays.asList(operands)));
    }

    static Or or(SelectorNode... operands) {
        return new Or(Lists.immutable.withAll(Arrays.asList(operands)));
    }

    static All all() {
        return new All();
    }

    private static ImmutableList<SelectorNode> checkOperands(String op, ImmutableList<SelectorNode> operands) {
        Objects.requireNonNull(operands, op + " operands");
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("'" + op + "' requires at least one operand");
        }
        if (operands.anySatisfy(Objects::isNull)) {
            throw new NullPointerException(op + " operand");
        }
        return operands;
    }
}
