package org.cuepoint.compiler.frontend.semantics;

import org.cuepoint.compiler.frontend.ast.AssetType;
import org.cuepoint.compiler.frontend.ast.NamedImport;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Infers the asset type of a named import from its file extension.
 */
public final class AssetTypeInference {

    private static final Map<String, AssetType> EXTENSIONS = Map.of(
            "html", AssetType.HTML,
            "css", AssetType.CSS,
            "mp4", AssetType.MEDIA,
            "webm", AssetType.MEDIA,
            "mp3", AssetType.MEDIA,
            "wav", AssetType.MEDIA);

    private static final Set<String> AMBIGUOUS = Set.of("ogg");

    private AssetTypeInference() {
        // Static utility
    }

    /**
     * @param path A file path.
     * @return The lower-case extension without dot, or an empty string if there is none.
     */
    public static String extensionOf(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1 || dot == path.length() - 1) return "";
        return path.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * @param path A file path.
     * @return The type implied by the extension; empty for unknown or ambiguous extensions.
     */
    public static Optional<AssetType> infer(String path) {
        return Optional.ofNullable(EXTENSIONS.get(extensionOf(path)));
    }

    /**
     * @param path A file path.
     * @return {@code true} if the extension could denote more than one asset type.
     */
    public static boolean isAmbiguous(String path) {
        return AMBIGUOUS.contains(extensionOf(path));
    }

    /**
     * @param imp A named import.
     * @return The explicit type if present, otherwise the inferred one.
     */
    public static Optional<AssetType> effectiveType(NamedImport imp) {
        if (imp.assetType() != null) return Optional.of(imp.assetType());
        return infer(imp.path());
    }
}
