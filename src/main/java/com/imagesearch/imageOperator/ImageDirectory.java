package com.imagesearch.imageOperator;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists candidate images of a search directory.
 */
@Slf4j
public final class ImageDirectory {
    public static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg");

    private ImageDirectory() {
    }

    /**
     * Regular files directly inside {@code directory} whose name ends with a recognized image
     * extension, compared case-insensitively. Sorted by file name so repeated scans visit
     * candidates in the same order.
     */
    public static List<Path> listImages(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            List<Path> images = files.filter(Files::isRegularFile)
                    .filter(ImageDirectory::isImageFile)
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()))
                    .collect(Collectors.toList());
            log.debug("Found {} candidate images in {}", images.size(), directory);
            return images;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
    }

    public static boolean isImageFile(Path path) {
        if (path == null || path.getFileName() == null) return false;
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
