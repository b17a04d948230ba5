package com.labelsel.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.labelsel.labels.StringSet;
import com.labelsel.selector.SelectorNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads selector trees from their JSON representation, for example
 * <pre>{"op": "and", "operands": [{"op": "eq", "key": "role", "value": "db"}, {"op": "has", "key": "env"}]}</pre>
 *
 * <p>This reads an already structured tree; it does not parse selector expression text.
 */
public class SelectorJsonReader {
    private static final Logger LOG = LoggerFactory.getLogger(SelectorJsonReader.class);

    private final JsonFactory factory = new JsonFactory();

    public SelectorNode read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return readDocument(parser);
        }
    }

    public SelectorNode read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return readDocument(parser);
        }
    }

    private SelectorNode readDocument(JsonParser parser) throws IOException {
        SelectorNode root = readNode(parser, parser.nextToken());
        JsonToken trailing = parser.nextToken();
        if (trailing != null) {
            throw new IOException("Unexpected trailing content " + trailing + " at " + parser.getCurrentLocation());
        }
        LOG.debug("Read selector tree {}", root);
        return root;
    }

    private SelectorNode readNode(JsonParser parser, JsonToken token) throws IOException {
        if (token != JsonToken.START_OBJECT) {
            throw new IOException("Expected selector node object but got " + token + " at " + parser.getCurrentLocation());
        }

        String op = null;
        String key = null;
        String value = null;
        MutableList<String> values = null;
        SelectorNode operand = null;
        MutableList<SelectorNode> operands = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            JsonToken fieldToken = parser.nextToken();
            switch (fieldName) {
                case "op" -> op = readString(parser, fieldToken, fieldName);
                case "key" -> key = readString(parser, fieldToken, fieldName);
                case "value" -> value = readString(parser, fieldToken, fieldName);
                case "values" -> values = readStrings(parser, fieldToken);
                case "operand" -> operand = readNode(parser, fieldToken);
                case "operands" -> operands = readNodes(parser, fieldToken);
                default -> throw new IOException("Unknown field '" + fieldName + "' at " + parser.getCurrentLocation());
            }
        }

        if (op == null) {
            throw new IOException("Selector node without 'op' at " + parser.getCurrentLocation());
        }

        try {
            return switch (op) {
                case "eq" -> new SelectorNode.Equals(require(parser, op, "key", key), require(parser, op, "value", value));
                case "ne" -> new SelectorNode.NotEquals(require(parser, op, "key", key), require(parser, op, "value", value));
                case "in" -> new SelectorNode.In(require(parser, op, "key", key), StringSet.from(require(parser, op, "values", values)));
                case "notin" -> new SelectorNode.NotIn(require(parser, op, "key", key), StringSet.from(require(parser, op, "values", values)));
                case "has" -> new SelectorNode.Has(require(parser, op, "key", key));
                case "not" -> new SelectorNode.Not(require(parser, op, "operand", operand));
                case "and" -> new SelectorNode.And(require(parser, op, "operands", operands).toImmutable());
                case "or" -> new SelectorNode.Or(require(parser, op, "operands", operands).toImmutable());
                case "all" -> new SelectorNode.All();
                default -> throw new IOException("Unknown selector op '" + op + "' at " + parser.getCurrentLocation());
            };
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid '" + op + "' node at " + parser.getCurrentLocation() + ": " + e.getMessage(), e);
        }
    }

    private MutableList<SelectorNode> readNodes(JsonParser parser, JsonToken token) throws IOException {
        if (token != JsonToken.START_ARRAY) {
            throw new IOException("Expected array of operands but got " + token + " at " + parser.getCurrentLocation());
        }
        MutableList<SelectorNode> nodes = Lists.mutable.empty();
        JsonToken next;
        while ((next = parser.nextToken()) != JsonToken.END_ARRAY) {
            nodes.add(readNode(parser, next));
        }
        return nodes;
    }

    private MutableList<String> readStrings(JsonParser parser, JsonToken token) throws IOException {
        if (token != JsonToken.START_ARRAY) {
            throw new IOException("Expected array of strings but got " + token + " at " + parser.getCurrentLocation());
        }
        MutableList<String> strings = Lists.mutable.empty();
        JsonToken next;
        while ((next = parser.nextToken()) != JsonToken.END_ARRAY) {
            strings.add(readString(parser, next, "values"));
        }
        return strings;
    }

    private static String readString(JsonParser parser, JsonToken token, String fieldName) throws IOException {
        if (token != JsonToken.VALUE_STRING) {
            throw new IOException("Expected string for '" + fieldName + "' but got " + token + " at " + parser.getCurrentLocation());
        }
        return parser.getText();
    }

    private static <T> T require(JsonParser parser, String op, String fieldName, T value) throws IOException {
        if (value == null) {
            throw new IOException("'" + op + "' node requires '" + fieldName + "' at " + parser.getCurrentLocation());
        }
        return value;
    }
}
