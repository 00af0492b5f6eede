package com.talewright.core.llm;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Jackson mapper used when a structured reply does not bind strictly. Models drift between
 * numbers and numeric strings, single values and lists, objects and names, so text, boolean and
 * number fields accept all of them.
 */
final class LenientBinding {

    private LenientBinding() {}

    static ObjectMapper mapper() {
        SimpleModule lenient = new SimpleModule("talewright-lenient")
                .addDeserializer(String.class, new TextDeserializer())
                .addDeserializer(Boolean.class, new FlagDeserializer())
                .addDeserializer(Double.class, new DecimalDeserializer())
                .addDeserializer(Integer.class, new WholeNumberDeserializer());
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule())
                .registerModule(lenient);
    }

    /**
     * Scalars as trimmed text, lists joined with commas, objects by their {@code name} field.
     */
    static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText().trim();
        }
        if (node.isObject() && node.has("name")) {
            return text(node.get("name"));
        }
        List<String> parts = new ArrayList<>();
        Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) {
            String part = text(values.next());
            if (part != null && !part.isEmpty()) {
                parts.add(part);
            }
        }
        return String.join(", ", parts);
    }

    static final class TextDeserializer extends StdDeserializer<String> {

        TextDeserializer() {
            super(String.class);
        }

        @Override
        public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return text(ctxt.readTree(p));
        }
    }

    static final class FlagDeserializer extends StdDeserializer<Boolean> {

        FlagDeserializer() {
            super(Boolean.class);
        }

        @Override
        public Boolean deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (node.isBoolean()) {
                return node.booleanValue();
            }
            if (node.isNumber()) {
                return node.doubleValue() != 0;
            }
            if (node.isTextual()) {
                switch (node.textValue().trim().toLowerCase(Locale.ROOT)) {
                    case "true", "yes", "y":
                        return Boolean.TRUE;
                    case "false", "no", "n":
                        return Boolean.FALSE;
                    default:
                        return null;
                }
            }
            return null;
        }
    }

    static final class DecimalDeserializer extends StdDeserializer<Double> {

        DecimalDeserializer() {
            super(Double.class);
        }

        @Override
        public Double deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (node.isNumber()) {
                return node.doubleValue();
            }
            return node.isTextual() ? parse(node.textValue()) : null;
        }

        static Double parse(String text) {
            try {
                return Double.parseDouble(text.replace(",", "").trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }

    static final class WholeNumberDeserializer extends StdDeserializer<Integer> {

        WholeNumberDeserializer() {
            super(Integer.class);
        }

        @Override
        public Integer deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (node.isNumber()) {
                return (int) Math.round(node.doubleValue());
            }
            Double parsed = node.isTextual() ? DecimalDeserializer.parse(node.textValue()) : null;
            return parsed == null ? null : (int) Math.round(parsed);
        }
    }
}
