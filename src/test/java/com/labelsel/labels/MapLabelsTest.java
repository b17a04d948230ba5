package com.labelsel.labels;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MapLabelsTest {

    @Test
    public void testPresentAndAbsent() {
        Labels labels = new MapLabels(Map.of("role", "db", "empty", ""));
        assertEquals(Optional.of("db"), labels.get("role"));
        assertEquals(Optional.of(""), labels.get("empty"));
        assertEquals(Optional.empty(), labels.get("env"));
    }

    @Test
    public void testNullMapIsEmpty() {
        Labels labels = new MapLabels(null);
        assertEquals(Optional.empty(), labels.get("role"));
    }

    @Test
    public void testReflectsMapAtLookupTime() {
        Map<String, String> backing = new HashMap<>();
        Labels labels = new MapLabels(backing);
        assertTrue(labels.get("role").isEmpty());

        backing.put("role", "db");
        assertEquals(Optional.of("db"), labels.get("role"));
    }
}
