package io.github.nicechester.commentariat.model;

import java.util.List;

/**
 * A commentary ingestion request: validated metadata plus its raw entry records.
 */
public record Manifest(Commentary commentary, List<RawEntry> entries) {
}
