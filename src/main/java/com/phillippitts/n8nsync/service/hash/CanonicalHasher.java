package com.phillippitts.n8nsync.service.hash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.n8nsync.domain.Workflow;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;

/**
 * Computes the canonical SHA-256 fingerprint of a normalized workflow.
 *
 * <p>The digest is taken over a compact serialization in which every object's keys are
 * sorted. Array order is preserved because node and connection order carry meaning.
 * Callers are expected to pass content that already went through
 * {@link com.phillippitts.n8nsync.service.normalize.WorkflowNormalizer#forStorage}.
 *
 * <p><b>Thread Safety:</b> stateless apart from the mapper, which is thread-safe once
 * configured.
 */
public final class CanonicalHasher {

    private final ObjectMapper mapper;

    public CanonicalHasher(ObjectMapper mapper) {
        // Compact copy: indentation must never leak into the digest
        this.mapper = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
    }

    public String hash(Workflow normalized) {
        return hash(mapper.valueToTree(normalized));
    }

    public String hash(JsonNode normalized) {
        try {
            String canonical = mapper.writeValueAsString(canonicalize(normalized));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workflow for hashing", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns a deep copy of {@code node} with object keys in lexicographic order.
     */
    static JsonNode canonicalize(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                copy.add(canonicalize(element));
            }
            return copy;
        }
        return node;
    }
}
