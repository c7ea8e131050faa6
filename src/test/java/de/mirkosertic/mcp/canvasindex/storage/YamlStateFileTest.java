package de.mirkosertic.mcp.canvasindex.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("YamlStateFile Tests")
class YamlStateFileTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read back what was saved and leave no temp file behind")
    void shouldSaveAndLoad() throws Exception {
        final YamlStateFile file = new YamlStateFile(tempDir.resolve("nested").resolve("state.yaml"));
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", 1);
        root.put("entries", List.of(Map.of("id", "file:1", "size", 42)));

        file.save(root);

        assertThat(file.exists()).isTrue();
        assertThat(tempDir.resolve("nested").resolve("state.yaml.tmp")).doesNotExist();
        final Map<String, Object> loaded = new YamlStateFile(file.getPath()).load();
        assertThat(YamlStateFile.number(loaded, "version", -1)).isEqualTo(1);
        assertThat(YamlStateFile.list(loaded, "entries")).singleElement()
                .satisfies(e -> assertThat(YamlStateFile.string(e, "id")).isEqualTo("file:1"));
    }

    @Test
    @DisplayName("Should treat missing, empty and malformed files as empty")
    void shouldTolerateUnreadableFiles() throws Exception {
        final Path path = tempDir.resolve("state.yaml");
        assertThat(new YamlStateFile(path).load()).isEmpty();

        Files.writeString(path, "");
        assertThat(new YamlStateFile(path).load()).isEmpty();

        Files.writeString(path, "- just\n- a list\n");
        assertThat(new YamlStateFile(path).load()).isEmpty();

        Files.writeString(path, "key: [unclosed\n");
        assertThat(new YamlStateFile(path).load()).isEmpty();
    }

    @Test
    @DisplayName("Should fall back for absent or invalid numbers")
    void shouldParseNumbers() {
        final Map<String, Object> map = Map.of("a", "17", "b", "x");

        assertThat(YamlStateFile.number(map, "a", 0)).isEqualTo(17);
        assertThat(YamlStateFile.number(map, "b", 5)).isEqualTo(5);
        assertThat(YamlStateFile.number(map, "c", 9)).isEqualTo(9);
        assertThat(YamlStateFile.list(map, "a")).isEmpty();
    }
}
