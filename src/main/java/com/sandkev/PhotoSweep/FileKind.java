package com.sandkev.PhotoSweep;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Decides how a file is fingerprinted. Only the filename extension is looked at.
 */
public enum FileKind {
    IMAGE,
    GENERIC;

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "bmp", "tiff");

    public static FileKind of(Path path) {
        Path name = path.getFileName();
        return name != null && isImageName(name.toString()) ? IMAGE : GENERIC;
    }

    public static boolean isImageName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return false;
        }
        return IMAGE_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
