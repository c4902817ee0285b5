package com.sandkev.PhotoSweep;

import java.io.IOException;
import java.nio.file.Path;

public interface HashProvider {
    String getHashHex(Path file) throws IOException;
    String describe();
}
