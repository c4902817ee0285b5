package com.sandkev.PhotoSweep;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import org.apache.commons.codec.binary.Hex;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.google.common.hash.Hashing.md5;

/**
 * Exact content digest for generic files. MD5 is enough: this is a duplicate
 * heuristic, not a security check.
 */
public enum HashType implements HashProvider {

    MD5(md5());

    static final int STREAM_BUFFER_LENGTH = 1024 * 8;

    private final HashFunction hashFunction;

    HashType(HashFunction hashFunction) {
        this.hashFunction = hashFunction;
    }

    @Override
    public String getHashHex(Path file) throws IOException {
        Hasher hasher = hashFunction.newHasher();
        byte[] buffer = new byte[STREAM_BUFFER_LENGTH];
        try (InputStream data = Files.newInputStream(file)) {
            int read = data.read(buffer, 0, STREAM_BUFFER_LENGTH);
            while (read > -1) {
                hasher.putBytes(buffer, 0, read);
                read = data.read(buffer, 0, STREAM_BUFFER_LENGTH);
            }
            return Hex.encodeHexString(hasher.hash().asBytes());
        }
    }

    @Override
    public String describe() {
        return this.name();
    }
}
