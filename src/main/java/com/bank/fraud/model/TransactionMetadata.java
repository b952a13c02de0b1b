package com.bank.fraud.model;

import com.bank.fraud.exception.MetadataParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Optional;

/**
 * Read-only view over a transaction's metadata JSON.
 *
 * Every accessor answers "absent" (an empty Optional) when the path is missing,
 * null, or holds a value of a different type. Nothing here throws once parsing
 * has succeeded.
 */
public final class TransactionMetadata {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TransactionMetadata EMPTY = new TransactionMetadata(MissingNode.getInstance());

    private final JsonNode root;

    private TransactionMetadata(JsonNode root) {
        this.root = root;
    }

    public static TransactionMetadata empty() {
        return EMPTY;
    }

    /**
     * Parse metadata JSON. Blank input yields {@link #empty()}.
     *
     * @throws MetadataParseException if the text is not a JSON object
     */
    public static TransactionMetadata parse(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MetadataParseException("Metadata is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (!node.isObject()) {
            throw new MetadataParseException("Metadata must be a JSON object but was " + node.getNodeType());
        }
        return new TransactionMetadata(node);
    }

    public boolean isEmpty() {
        return root.isMissingNode() || root.size() == 0;
    }

    public boolean has(String... path) {
        JsonNode node = resolve(path);
        return !node.isMissingNode() && !node.isNull();
    }

    public Optional<String> text(String... path) {
        JsonNode node = resolve(path);
        if (!node.isTextual() || node.asText().isBlank()) return Optional.empty();
        return Optional.of(node.asText());
    }

    public Optional<Double> number(String... path) {
        JsonNode node = resolve(path);
        if (!node.isNumber()) return Optional.empty();
        return Optional.of(node.doubleValue());
    }

    public Optional<Boolean> flag(String... path) {
        JsonNode node = resolve(path);
        if (!node.isBoolean()) return Optional.empty();
        return Optional.of(node.booleanValue());
    }

    /**
     * Check numbers arrive both as strings and as integers; normalize either to text.
     */
    public Optional<String> identifier(String... path) {
        JsonNode node = resolve(path);
        if (node.isTextual() && !node.asText().isBlank()) return Optional.of(node.asText().trim());
        if (node.isIntegralNumber()) return Optional.of(node.asText());
        return Optional.empty();
    }

    private JsonNode resolve(String... path) {
        JsonNode node = root;
        for (String segment : path) {
            node = node.path(segment);
            if (node.isMissingNode()) break;
        }
        return node;
    }
}
