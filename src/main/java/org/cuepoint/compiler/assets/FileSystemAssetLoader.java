package org.cuepoint.compiler.assets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * {@link IAssetLoader} backed by the local file system.
 */
public final class FileSystemAssetLoader implements IAssetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemAssetLoader.class);

    @Override
    public boolean fileExists(String path) {
        return Files.isRegularFile(Path.of(path));
    }

    @Override
    public String loadFile(String path) throws FileLoadException {
        try {
            String content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
            LOG.debug("Loaded {} ({} chars)", path, content.length());
            return content;
        } catch (NoSuchFileException e) {
            throw new FileLoadException(path, FileLoadException.Reason.NOT_FOUND, e);
        } catch (AccessDeniedException e) {
            throw new FileLoadException(path, FileLoadException.Reason.PERMISSION_DENIED, e);
        } catch (IOException e) {
            throw new FileLoadException(path, FileLoadException.Reason.READ_ERROR, e);
        }
    }

    @Override
    public String resolvePath(String sourcePath, String relativePath) throws PathSecurityException {
        Path base = Path.of(sourcePath).toAbsolutePath().normalize().getParent();
        if (base == null) {
            throw new PathSecurityException(relativePath, sourcePath);
        }
        Path resolved = base.resolve(relativePath).normalize();
        if (!resolved.startsWith(base)) {
            throw new PathSecurityException(relativePath, base.toString());
        }
        return resolved.toString().replace('\\', '/');
    }
}
