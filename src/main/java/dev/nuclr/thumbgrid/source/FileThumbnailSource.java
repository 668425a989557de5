package dev.nuclr.thumbgrid.source;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the original image file named by the display path.
 * Only formats the JDK's ImageIO can decode are offered.
 */
@Slf4j
public class FileThumbnailSource implements ThumbnailSource {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "bmp", "wbmp");

    @Override
    public String name() {
        return "File";
    }

    @Override
    public Optional<byte[]> fetchSourceBytes(String contentKey, String displayPath) throws IOException {
        if (displayPath == null || !supports(displayPath)) {
            return Optional.empty();
        }
        Path file;
        try {
            file = Path.of(displayPath);
        } catch (InvalidPathException e) {
            log.debug("Not a usable path: {}", displayPath);
            return Optional.empty();
        }
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(file));
    }

    static boolean supports(String path) {
        String ext = extension(path);
        return ext != null && SUPPORTED_EXTENSIONS.contains(ext);
    }

    static String extension(String path) {
        int dot = path.lastIndexOf('.');
        int sep = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        if (dot <= sep || dot == path.length() - 1) return null;
        return path.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
