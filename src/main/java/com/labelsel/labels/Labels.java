package com.labelsel.labels;

import java.util.Optional;

/**
 * Source of label values consulted while a selector is evaluated.
 * Implementations may be backed by a fixed map or compute values on the fly.
 */
public interface Labels {
    Optional<String> get(String key);
}
