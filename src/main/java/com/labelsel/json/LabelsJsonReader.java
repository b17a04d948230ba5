package com.labelsel.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a label set from a flat JSON object such as {@code {"role": "db", "env": "prod"}}.
 */
public class LabelsJsonReader {
    private static final Logger LOG = LoggerFactory.getLogger(LabelsJsonReader.class);

    private final JsonFactory factory = new JsonFactory();

    public MutableMap<String, String> read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Expected labels object but got " + token + " at " + parser.getCurrentLocation());
            }

            MutableMap<String, String> labels = Maps.mutable.empty();
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String key = parser.getCurrentName();
                if (parser.nextToken() != JsonToken.VALUE_STRING) {
                    throw new IOException("Label '" + key + "' must have a string value at " + parser.getCurrentLocation());
                }
                labels.put(key, parser.getText());
            }

            if (parser.nextToken() != null) {
                throw new IOException("Unexpected trailing content at " + parser.getCurrentLocation());
            }
            LOG.debug("Read {} labels", labels.size());
            return labels;
        }
    }
}
