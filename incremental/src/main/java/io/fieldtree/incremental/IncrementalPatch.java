package io.fieldtree.incremental;

import com.fasterxml.jackson.databind.JsonNode;
import io.fieldtree.core.ResponsePath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One deferred piece of a response.
 *
 * @param path    where the piece belongs: the deferred field itself, or the object a deferred
 *                fragment (or field) hangs off
 * @param label   defer label, null for unlabeled deferrals
 * @param data    the field value, or an object holding the delivered keys
 * @param isFinal true on the last patch of the stream
 */
public record IncrementalPatch(ResponsePath path, String label, JsonNode data, boolean isFinal) {

    public IncrementalPatch {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(data, "data");
    }

    /**
     * Reads {@code {"path": [...], "label": "...", "data": {...}, "isFinal": true}}.
     * {@code "hasNext": false} is accepted in place of {@code "isFinal": true}.
     */
    public static IncrementalPatch fromJson(JsonNode node) {
        if (node == null || !node.isObject()) throw new IllegalArgumentException("patch must be a JSON object");

        JsonNode rawPath = node.get("path");
        if (rawPath == null || !rawPath.isArray()) throw new IllegalArgumentException("patch needs a 'path' array");
        List<Object> segments = new ArrayList<>(rawPath.size());
        for (JsonNode s : rawPath) {
            if (s.isTextual()) {
                segments.add(s.textValue());
            } else if (s.isInt()) {
                segments.add(s.intValue());
            } else {
                throw new IllegalArgumentException("path segment must be a key or an index: " + s);
            }
        }

        JsonNode label = node.get("label");
        JsonNode data = node.get("data");
        if (data == null) throw new IllegalArgumentException("patch needs 'data'");

        boolean isFinal;
        if (node.has("isFinal")) {
            isFinal = node.get("isFinal").asBoolean();
        } else {
            isFinal = node.has("hasNext") && !node.get("hasNext").asBoolean();
        }
        return new IncrementalPatch(new ResponsePath(segments),
                label == null || label.isNull() ? null : label.asText(), data, isFinal);
    }
}
