package org.cuepoint.compiler.registry;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.assets.FileLoadException;
import org.cuepoint.compiler.assets.IAssetLoader;
import org.cuepoint.compiler.assets.PathSecurityException;
import org.cuepoint.compiler.diagnostics.Diagnostic;
import org.cuepoint.compiler.frontend.ast.AssetType;
import org.cuepoint.compiler.frontend.ast.ImportCategory;
import org.cuepoint.compiler.frontend.semantics.ImportGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.cuepoint.compiler.AstFixtures.DOC_URI;
import static org.cuepoint.compiler.AstFixtures.defaultImport;
import static org.cuepoint.compiler.AstFixtures.namedImport;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RegistryLoader} with a mocked {@link IAssetLoader}.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class RegistryLoaderTest {

    private static final String DOC_PATH = "/project/presentation.eligian";

    @Mock
    private IAssetLoader assets;

    private Registries registries;
    private RegistryLoader loader;

    @BeforeEach
    void setUp() {
        registries = Registries.create();
        loader = new RegistryLoader(registries, assets);
    }

    @Test
    void loadsStylesheetsAndLabels() throws Exception {
        // Given
        ImportGraph imports = new ImportGraph(DOC_URI, List.of(
                defaultImport(ImportCategory.STYLES, "./main.css"),
                namedImport("theme", "./theme.css", null),
                defaultImport(ImportCategory.LABELS, "./labels.json")));
        when(assets.resolvePath(DOC_PATH, "./main.css")).thenReturn("/project/main.css");
        when(assets.resolvePath(DOC_PATH, "./theme.css")).thenReturn("/project/theme.css");
        when(assets.resolvePath(DOC_PATH, "./labels.json")).thenReturn("/project/labels.json");
        when(assets.loadFile("/project/main.css")).thenReturn(".button { }");
        when(assets.loadFile("/project/theme.css")).thenReturn("#hero .dark { }");
        when(assets.loadFile("/project/labels.json")).thenReturn("{ \"en-US\": { \"welcome\": \"Hi\" } }");

        // When
        List<Diagnostic> result = loader.loadDocument(DOC_URI, DOC_PATH, imports);

        // Then
        assertThat(result).isEmpty();
        assertThat(registries.css().classesForDocument(DOC_URI)).containsExactly("button", "dark");
        assertThat(registries.css().idsForDocument(DOC_URI)).containsExactly("hero");
        assertThat(registries.labels().labelIdsForDocument(DOC_URI)).containsExactly("welcome");
        assertThat(registries.locales().localeCodesForDocument(DOC_URI)).containsExactly("en-US");
    }

    @Test
    void reportsMissingFileAndTraversal() throws Exception {
        ImportGraph imports = new ImportGraph(DOC_URI, List.of(
                defaultImport(ImportCategory.STYLES, "./missing.css"),
                defaultImport(ImportCategory.LABELS, "../../etc/labels.json")));
        when(assets.resolvePath(DOC_PATH, "./missing.css")).thenReturn("/project/missing.css");
        when(assets.loadFile("/project/missing.css"))
                .thenThrow(new FileLoadException("/project/missing.css", FileLoadException.Reason.NOT_FOUND, null));
        when(assets.resolvePath(DOC_PATH, "../../etc/labels.json"))
                .thenThrow(new PathSecurityException("../../etc/labels.json", "/project"));

        List<Diagnostic> result = loader.loadDocument(DOC_URI, DOC_PATH, imports);

        assertThat(result).extracting(Diagnostic::code)
                .containsExactly(DiagnosticCode.ASSET_LOAD_FAILED, DiagnosticCode.PATH_TRAVERSAL);
        assertThat(result.get(0).message()).isEqualTo("File not found: /project/missing.css");
        assertThat(registries.css().hasStylesFor(DOC_URI)).isFalse();
        verify(assets, never()).loadFile("/etc/labels.json");
    }

    @Test
    void reportsUnparsableFiles() throws Exception {
        ImportGraph imports = new ImportGraph(DOC_URI, List.of(
                defaultImport(ImportCategory.STYLES, "./broken.css"),
                defaultImport(ImportCategory.LABELS, "./broken.json")));
        when(assets.resolvePath(DOC_PATH, "./broken.css")).thenReturn("/project/broken.css");
        when(assets.resolvePath(DOC_PATH, "./broken.json")).thenReturn("/project/broken.json");
        when(assets.loadFile("/project/broken.css")).thenReturn(".a { ");
        when(assets.loadFile("/project/broken.json")).thenReturn("{ oops");

        List<Diagnostic> result = loader.loadDocument(DOC_URI, DOC_PATH, imports);

        assertThat(result).extracting(Diagnostic::code)
                .containsExactly(DiagnosticCode.INVALID_STYLESHEET, DiagnosticCode.INVALID_LABELS_FILE);
    }

    @Test
    void reloadReplacesTheFileEntry() throws Exception {
        // Given
        ImportGraph imports = new ImportGraph(DOC_URI, List.of(defaultImport(ImportCategory.STYLES, "./main.css")));
        when(assets.resolvePath(DOC_PATH, "./main.css")).thenReturn("/project/main.css");
        when(assets.loadFile("/project/main.css")).thenReturn(".old { }", ".new { }");
        loader.loadDocument(DOC_URI, DOC_PATH, imports);

        // When
        List<Diagnostic> result = loader.reloadFile("/project/main.css");

        // Then
        assertThat(result).isEmpty();
        assertThat(registries.css().classesForDocument(DOC_URI)).containsExactly("new");
    }

    @Test
    void reloadOfUnknownFileDoesNothing() throws Exception {
        assertThat(loader.reloadFile("/project/other.css")).isEmpty();
        verify(assets, never()).loadFile(anyString());
    }

    @Test
    void closeDocumentForgetsItsFiles() throws Exception {
        ImportGraph imports = new ImportGraph(DOC_URI, List.of(
                namedImport("theme", "./theme.css", AssetType.CSS)));
        when(assets.resolvePath(DOC_PATH, "./theme.css")).thenReturn("/project/theme.css");
        when(assets.loadFile("/project/theme.css")).thenReturn(".dark { }");
        loader.loadDocument(DOC_URI, DOC_PATH, imports);

        loader.closeDocument(DOC_URI);

        assertThat(registries.css().hasStylesFor(DOC_URI)).isFalse();
        assertThat(registries.css().hasFile("/project/theme.css")).isFalse();
    }
}
