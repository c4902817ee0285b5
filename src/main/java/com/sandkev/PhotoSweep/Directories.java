package com.sandkev.PhotoSweep;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;

public final class Directories {

    private Directories() {
    }

    /**
     * A root given as a symbolic link is resolved, otherwise the no-follow walk would see only the link.
     *
     * @return the real path of the directory
     * @throws NotDirectoryException when the path is missing or not a directory
     */
    public static Path requireDirectory(Path directory) throws IOException {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new NotDirectoryException(String.valueOf(directory));
        }
        return directory.toRealPath();
    }
}
