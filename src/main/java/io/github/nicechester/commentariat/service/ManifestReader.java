package io.github.nicechester.commentariat.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nicechester.commentariat.exception.ManifestException;
import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.Manifest;
import io.github.nicechester.commentariat.model.RawEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads commentary manifests.
 *
 * <p>A manifest is a JSON object:
 * <pre>
 * {
 *   "commentary": {"slug": "mhc", "name": "Matthew Henry", "description": ..., "source": ...,
 *                  "license": ..., "language": "en"},
 *   "entries": [ {"book": "Jn", "chapter": 3, "verse": "16", "text": "..."}, ... ]
 * }
 * </pre>
 * or the same with {@code "entries_file": "mhc.ndjson"}, a file of one JSON object per line
 * resolved against the manifest's directory.
 *
 * <p>Metadata problems and an unusable entries source are structural and raise
 * {@link ManifestException}. Individual records are not validated here; a line that is not
 * valid JSON is passed on as an unparsable {@link RawEntry} so it can be reported with the rest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ManifestReader {

    private static final Pattern URL_SAFE_SLUG = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final ObjectMapper objectMapper;

    public Manifest read(Path manifestPath) {
        JsonNode root;
        try (InputStream inputStream = Files.newInputStream(manifestPath)) {
            root = objectMapper.readTree(inputStream);
        } catch (JsonProcessingException e) {
            throw new ManifestException("Manifest is not valid JSON: " + manifestPath + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ManifestException("Cannot read manifest: " + manifestPath, e);
        }

        Path baseDir = manifestPath.toAbsolutePath().getParent();
        return fromJson(root, baseDir);
    }

    /**
     * Builds a manifest from an already parsed document.
     *
     * @param baseDir directory {@code entries_file} is resolved against
     */
    public Manifest fromJson(JsonNode root, Path baseDir) {
        if (root == null || !root.isObject()) {
            throw new ManifestException("Top-level JSON must be an object");
        }

        JsonNode meta = root.get("commentary");
        if (meta == null || !meta.isObject()) {
            throw new ManifestException("commentary object is required");
        }
        Commentary commentary = readCommentary(meta);

        JsonNode entries = root.get("entries");
        JsonNode entriesFile = root.get("entries_file");
        if (isPresent(entries) && isPresent(entriesFile)) {
            throw new ManifestException("Use either entries or entries_file, not both");
        }

        List<RawEntry> records;
        if (isPresent(entries)) {
            records = readInline(entries);
        } else if (isPresent(entriesFile)) {
            if (!entriesFile.isTextual() || entriesFile.asText().isBlank()) {
                throw new ManifestException("entries_file must be a path");
            }
            Path base = baseDir != null ? baseDir : Path.of(".");
            records = readNdjson(base.resolve(entriesFile.asText()).normalize());
        } else {
            throw new ManifestException("Missing entries or entries_file");
        }

        log.debug("Read manifest for {} with {} records", commentary.slug(), records.size());
        return new Manifest(commentary, records);
    }

    private Commentary readCommentary(JsonNode meta) {
        String slug = text(meta, "slug");
        String name = text(meta, "name");
        if (slug == null || slug.isBlank() || name == null || name.isBlank()) {
            throw new ManifestException("commentary.slug and commentary.name are required");
        }
        slug = slug.trim();
        if (!URL_SAFE_SLUG.matcher(slug).matches()) {
            throw new ManifestException("commentary.slug must be URL-safe (letters, digits, '.', '_', '-'): " + slug);
        }

        return Commentary.builder()
            .slug(slug)
            .name(name.trim())
            .description(text(meta, "description"))
            .source(text(meta, "source"))
            .license(text(meta, "license"))
            .language(text(meta, "language"))
            .build();
    }

    private List<RawEntry> readInline(JsonNode entries) {
        if (!entries.isArray()) {
            throw new ManifestException("entries must be a list");
        }
        List<RawEntry> records = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            records.add(RawEntry.parsed("entries[" + i + "]", entries.get(i)));
        }
        return records;
    }

    private List<RawEntry> readNdjson(Path entriesPath) {
        List<RawEntry> records = new ArrayList<>();
        String fileName = entriesPath.getFileName().toString();

        try (BufferedReader reader = Files.newBufferedReader(entriesPath, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                String location = fileName + ":" + lineNumber;
                try {
                    records.add(RawEntry.parsed(location, objectMapper.readTree(trimmed)));
                } catch (JsonProcessingException e) {
                    records.add(RawEntry.unparsable(location, trimmed, "Invalid JSON line: " + e.getOriginalMessage()));
                }
            }
        } catch (IOException e) {
            throw new ManifestException("Cannot read entries_file: " + entriesPath, e);
        }

        log.info("Read {} records from {}", records.size(), entriesPath);
        return records;
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value.toString();
    }
}
