package dev.nuclr.thumbgrid.source;

import dev.nuclr.thumbgrid.ResultItem;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the previewable files directly inside one directory, sorted by path.
 *
 * <p>The content key is the SHA-256 of file name, size and modification time.
 * A rewritten file gets a fresh thumbnail, while an untouched one keeps hitting
 * the disk cache even after it is moved to another directory.
 */
@Slf4j
public class DirectoryResultProvider implements ResultProvider {

    private final Path directory;

    public DirectoryResultProvider(Path directory) {
        this.directory = directory;
    }

    @Override
    public List<ResultItem> results() throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        List<Path> files;
        try (Stream<Path> s = Files.list(directory)) {
            files = s.filter(Files::isRegularFile)
                     .filter(p -> isPreviewable(p.getFileName().toString()))
                     .sorted()
                     .collect(Collectors.toList());
        }

        List<ResultItem> items = new ArrayList<>(files.size());
        for (Path p : files) {
            BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
            String key = contentKey(p.getFileName().toString(), attrs.size(), attrs.lastModifiedTime().toMillis());
            items.add(new ResultItem(items.size(), key, p.toString()));
        }
        log.info("Listed {} previewable file(s) in {}", items.size(), directory);
        return items;
    }

    static boolean isPreviewable(String name) {
        String ext = FileThumbnailSource.extension(name);
        return ext != null && (FileThumbnailSource.SUPPORTED_EXTENSIONS.contains(ext) || ext.equals("pdf"));
    }

    static String contentKey(String fileName, long size, long modifiedMillis) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String material = fileName + "\n" + size + "\n" + modifiedMillis;
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
