package org.cuepoint.compiler.assets;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemAssetLoader} against a temporary directory.
 */
@Tag("integration")
class FileSystemAssetLoaderTest {

    @TempDir
    Path tempDir;

    private final FileSystemAssetLoader loader = new FileSystemAssetLoader();

    @Test
    void readsUtf8Content() throws IOException, FileLoadException {
        Path file = tempDir.resolve("labels.json");
        Files.writeString(file, "{ \"de-DE\": { \"greeting\": \"Grüße\" } }", StandardCharsets.UTF_8);

        assertThat(loader.fileExists(file.toString())).isTrue();
        assertThat(loader.loadFile(file.toString())).contains("Grüße");
    }

    @Test
    void missingFileHasNotFoundReason() {
        String missing = tempDir.resolve("missing.css").toString();

        assertThat(loader.fileExists(missing)).isFalse();
        assertThatThrownBy(() -> loader.loadFile(missing))
                .isInstanceOf(FileLoadException.class)
                .satisfies(e -> assertThat(((FileLoadException) e).reason()).isEqualTo(FileLoadException.Reason.NOT_FOUND));
    }

    @Test
    void directoryIsNotAFile() {
        assertThat(loader.fileExists(tempDir.toString())).isFalse();
        assertThatThrownBy(() -> loader.loadFile(tempDir.toString())).isInstanceOf(FileLoadException.class);
    }

    @Test
    void resolvesRelativeToTheDocumentDirectory() throws PathSecurityException {
        String document = tempDir.resolve("presentation.eligian").toString();

        String resolved = loader.resolvePath(document, "./styles/main.css");

        assertThat(resolved).isEqualTo(tempDir.toAbsolutePath().normalize().resolve("styles/main.css").toString());
    }

    @Test
    void rejectsPathsEscapingTheDocumentDirectory() {
        String document = tempDir.resolve("site/presentation.eligian").toString();

        assertThatThrownBy(() -> loader.resolvePath(document, "../secret.css"))
                .isInstanceOf(PathSecurityException.class);
        assertThatThrownBy(() -> loader.resolvePath(document, "./a/../../secret.css"))
                .isInstanceOf(PathSecurityException.class);
    }
}
