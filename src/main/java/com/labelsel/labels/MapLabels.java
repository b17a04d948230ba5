package com.labelsel.labels;

import java.util.Map;
import java.util.Optional;

public record MapLabels(Map<String, String> values) implements Labels {
    public MapLabels {
        values = values != null ? values : Map.of();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }
}
