package com.labelsel.selector;

/**
 * Turns a piece of text into a short, stable identifier. The namespace tag separates
 * identifier kinds that share the same identifier space.
 */
@FunctionalInterface
public interface UniqueIdDeriver {
    String derive(String namespaceTag, String text);
}
