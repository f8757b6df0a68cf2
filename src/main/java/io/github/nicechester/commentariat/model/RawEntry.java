package io.github.nicechester.commentariat.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry record as read from a manifest, before resolution.
 *
 * @param location  where the record came from, e.g. {@code entries[3]} or {@code notes.ndjson:12}
 * @param rawText   the record exactly as supplied, kept for error reports
 * @param node      parsed record, or {@code null} when the text was not valid JSON
 * @param parseError why {@code node} is missing, otherwise {@code null}
 */
public record RawEntry(String location, String rawText, JsonNode node, String parseError) {

    public static RawEntry parsed(String location, JsonNode node) {
        return new RawEntry(location, node.toString(), node, null);
    }

    public static RawEntry unparsable(String location, String rawText, String parseError) {
        return new RawEntry(location, rawText, null, parseError);
    }
}
