package com.imagesearch.imageOperator;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a file cannot be turned into a {@link PixelGrid}.
 */
public class DecodeException extends IOException {
    private final Path path;

    public DecodeException(Path path, String message) {
        super("Cannot decode " + path + ": " + message);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
