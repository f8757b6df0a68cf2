package io.github.nicechester.commentariat.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nicechester.commentariat.exception.ErrorKind;
import io.github.nicechester.commentariat.exception.ManifestException;
import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.Manifest;
import io.github.nicechester.commentariat.model.RawEntry;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ManifestReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ManifestReader reader = new ManifestReader(objectMapper);

    @TempDir
    Path tempDir;

    private Manifest fromJson(String json) throws Exception {
        return reader.fromJson(objectMapper.readTree(json), tempDir);
    }

    @Test
    void readsInlineEntries() throws Exception {
        Path path = tempDir.resolve("manifest.json");
        Files.writeString(path, """
            {
              "commentary": {"slug": " mhc ", "name": "Matthew Henry", "description": "Concise",
                             "source": "CCEL", "license": "Public Domain", "language": "en"},
              "entries": [
                {"book": "Jn", "chapter": 3, "verse": 16, "text": "For God so loved"},
                {"book": "Rom", "chapter": 8, "verse": "1-3", "text": "No condemnation"}
              ]
            }
            """);

        Manifest manifest = reader.read(path);

        Commentary commentary = manifest.commentary();
        assertThat(commentary.slug()).isEqualTo("mhc");
        assertThat(commentary.name()).isEqualTo("Matthew Henry");
        assertThat(commentary.license()).isEqualTo("Public Domain");
        assertThat(manifest.entries()).extracting(RawEntry::location).containsExactly("entries[0]", "entries[1]");
        assertThat(manifest.entries().get(1).node().get("verse").asText()).isEqualTo("1-3");
    }

    @Test
    void readsNdjsonRelativeToTheManifest() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("mhc"));
        Files.writeString(dir.resolve("mhc.ndjson"), """
            {"book": "Gen", "chapter": 1, "verse": 1, "text": "In the beginning"}

            {not json}
            {"book": "Gen", "chapter": 1, "verse": 2, "text": "Without form"}
            """);
        Path path = dir.resolve("manifest.json");
        Files.writeString(path, """
            {"commentary": {"slug": "mhc", "name": "MHC"}, "entries_file": "mhc.ndjson"}
            """);

        Manifest manifest = reader.read(path);

        assertThat(manifest.entries()).extracting(RawEntry::location)
            .containsExactly("mhc.ndjson:1", "mhc.ndjson:3", "mhc.ndjson:4");
        RawEntry broken = manifest.entries().get(1);
        assertThat(broken.node()).isNull();
        assertThat(broken.rawText()).isEqualTo("{not json}");
        assertThat(broken.parseError()).startsWith("Invalid JSON line");
    }

    @Test
    void optionalMetadataMayBeAbsent() throws Exception {
        Manifest manifest = fromJson("{\"commentary\": {\"slug\": \"x\", \"name\": \"X\"}, \"entries\": []}");

        assertThat(manifest.commentary().description()).isNull();
        assertThat(manifest.commentary().language()).isNull();
        assertThat(manifest.entries()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "[]",
        "{\"entries\": []}",
        "{\"commentary\": \"mhc\", \"entries\": []}",
        "{\"commentary\": {\"name\": \"No slug\"}, \"entries\": []}",
        "{\"commentary\": {\"slug\": \"mhc\", \"name\": \" \"}, \"entries\": []}",
        "{\"commentary\": {\"slug\": \"has space\", \"name\": \"X\"}, \"entries\": []}",
        "{\"commentary\": {\"slug\": \"a/b\", \"name\": \"X\"}, \"entries\": []}",
        "{\"commentary\": {\"slug\": \"mhc\", \"name\": \"X\"}}",
        "{\"commentary\": {\"slug\": \"mhc\", \"name\": \"X\"}, \"entries\": {}}",
        "{\"commentary\": {\"slug\": \"mhc\", \"name\": \"X\"}, \"entries\": [], \"entries_file\": \"x.ndjson\"}",
        "{\"commentary\": {\"slug\": \"mhc\", \"name\": \"X\"}, \"entries_file\": \"missing.ndjson\"}",
        "{\"commentary\": {\"slug\": \"mhc\", \"name\": \"X\"}, \"entries_file\": 5}"
    })
    void structuralProblemsFailFast(String json) {
        assertThatThrownBy(() -> fromJson(json))
            .isInstanceOf(ManifestException.class)
            .extracting(e -> ((ManifestException) e).getKind())
            .isEqualTo(ErrorKind.STRUCTURAL_MANIFEST_ERROR);
    }

    @Test
    void reportsWhichStructuralRuleFailed() {
        assertThatThrownBy(() -> fromJson("{\"commentary\": {\"name\": \"X\"}, \"entries\": []}"))
            .hasMessage("commentary.slug and commentary.name are required");
        assertThatThrownBy(() -> fromJson("{\"commentary\": {\"slug\": \"x\", \"name\": \"X\"}}"))
            .hasMessage("Missing entries or entries_file");
        assertThatThrownBy(() -> fromJson("[]"))
            .hasMessage("Top-level JSON must be an object");
    }

    @Test
    void invalidManifestFileIsStructural() throws Exception {
        Path path = tempDir.resolve("broken.json");
        Files.writeString(path, "{ not json");

        assertThatThrownBy(() -> reader.read(path))
            .isInstanceOf(ManifestException.class)
            .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> reader.read(tempDir.resolve("absent.json")))
            .isInstanceOf(ManifestException.class)
            .hasMessageStartingWith("Cannot read manifest");
    }
}
