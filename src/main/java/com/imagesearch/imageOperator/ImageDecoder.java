package com.imagesearch.imageOperator;

import java.nio.file.Path;

@FunctionalInterface
public interface ImageDecoder {
    PixelGrid decode(Path path) throws DecodeException;
}
