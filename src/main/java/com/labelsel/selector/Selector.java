package com.labelsel.selector;

import com.labelsel.labels.Labels;
import com.labelsel.labels.MapLabels;
import com.labelsel.output.CanonicalFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * A label selector: an expression tree plus its canonical string and unique ID.
 *
 * <p>Both derived values are computed on first use and then reused. Instances are safe
 * to share between threads. Racing first calls may compute the value more than once,
 * but the computation is deterministic and the fields are volatile, so every caller
 * sees the same fully built string.
 */
public final class Selector {
    /** Namespace tag for selector IDs. */
    public static final String UNIQUE_ID_PREFIX = "s";

    private static final Logger LOG = LoggerFactory.getLogger(Selector.class);
    private static final SelectorEvaluator EVALUATOR = new SelectorEvaluator();
    private static final CanonicalFormatter FORMATTER = new CanonicalFormatter();

    private final SelectorNode root;
    private final UniqueIdDeriver idDeriver;

    private volatile String cachedString;
    private volatile String cachedId;

    public Selector(SelectorNode root, UniqueIdDeriver idDeriver) {
        this.root = Objects.requireNonNull(root, "root");
        this.idDeriver = Objects.requireNonNull(idDeriver, "idDeriver");
    }

    public static Selector of(SelectorNode root) {
        return new Selector(root, Sha224UniqueIdDeriver.INSTANCE);
    }

    public SelectorNode root() {
        return root;
    }

    public boolean evaluate(Map<String, String> labels) {
        return evaluateLabels(new MapLabels(labels));
    }

    public boolean evaluateLabels(Labels labels) {
        return EVALUATOR.evaluate(root, labels);
    }

    /**
     * Returns the canonical form of this selector.
     */
    @Override
    public String toString() {
        String s = cachedString;
        if (s == null) {
            s = FORMATTER.format(root);
            LOG.debug("Computed canonical selector {}", s);
            cachedString = s;
        }
        return s;
    }

    public String uniqueId() {
        String id = cachedId;
        if (id == null) {
            id = idDeriver.derive(UNIQUE_ID_PREFIX, toString());
            LOG.debug("Derived unique id {} for selector {}", id, this);
            cachedId = id;
        }
        return id;
    }

    /**
     * Selectors are equal when their canonical strings are.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Selector other && toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
