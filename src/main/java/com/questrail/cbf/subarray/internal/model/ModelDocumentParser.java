package com.questrail.cbf.subarray.internal.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.cbf.api.ModelType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Reads model documents of the form
 * <pre>
 *   {"delayModel": [ {"epoch": 1700000000.5, "delayDetails": {...}}, ... ]}
 * </pre>
 * The top-level key names the {@link ModelType}; each element carries an
 * epoch in seconds since the Unix epoch and a details object that becomes the
 * entry payload.
 */
public final class ModelDocumentParser
{
    static final String EPOCH = "epoch";

    /** 9999-12-31T23:59:59Z; later epochs are almost always milliseconds sent as seconds. */
    static final long MAX_EPOCH_SECONDS = 253_402_300_799L;

    private final ObjectMapper mapper;

    public ModelDocumentParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Determines the model type from the document's top-level key.
     *
     * @throws ModelDocumentException if the document is not JSON or names no known model
     */
    public ModelType detectType(String raw) {
        JsonNode root = readObject(raw);
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            var type = ModelType.fromDocumentKey(names.next());
            if (type.isPresent()) {
                return type.get();
            }
        }
        throw new ModelDocumentException("Document names no known model type");
    }

    /**
     * Reads the entries of a {@code type} document.
     *
     * @throws ModelDocumentException if the document or any entry is malformed
     */
    public ModelUpdateBatch parse(ModelType type, String raw) {
        JsonNode root = readObject(raw);
        JsonNode entries = root.get(type.documentKey());
        if (entries == null || !entries.isArray()) {
            throw new ModelDocumentException("'" + type.documentKey() + "' must be an array");
        }

        List<ModelUpdateEntry> result = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            JsonNode epoch = entry.get(EPOCH);
            if (epoch == null || !epoch.isNumber()) {
                throw new ModelDocumentException("Entry without numeric '" + EPOCH + "'");
            }
            JsonNode details = entry.get(type.detailsKey());
            if (details == null || details.isNull()) {
                throw new ModelDocumentException("Entry without '" + type.detailsKey() + "'");
            }
            result.add(new ModelUpdateEntry(toInstant(epoch.asDouble()), write(details)));
        }
        return new ModelUpdateBatch(type, result);
    }

    /**
     * @throws ModelDocumentException if the epoch is not finite or lies outside
     *         exceeds {@link #MAX_EPOCH_SECONDS} in magnitude
     */
    static Instant toInstant(double epochSeconds) {
        if (!Double.isFinite(epochSeconds) || Math.abs(epochSeconds) > MAX_EPOCH_SECONDS) {
            throw new ModelDocumentException("Epoch " + epochSeconds + " exceeds " + MAX_EPOCH_SECONDS + " seconds in magnitude");
        }
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1e9);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private JsonNode readObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ModelDocumentException("Empty model document");
        }
        try {
            JsonNode root = mapper.readTree(raw);
            if (root == null || !root.isObject()) {
                throw new ModelDocumentException("Model document must be a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ModelDocumentException("Model document is not valid JSON", e);
        }
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ModelDocumentException("Cannot serialise entry payload", e);
        }
    }
}
