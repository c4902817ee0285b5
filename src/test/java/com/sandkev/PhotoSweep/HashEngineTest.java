package com.sandkev.PhotoSweep;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HashEngineTest {

    @TempDir
    Path dir;

    private final HashEngine engine = new HashEngine();

    private static ScanEntry entryFor(Path file) throws IOException {
        Instant modified = Files.getLastModifiedTime(file).toInstant();
        return new ScanEntry(file, Files.size(file), modified, modified);
    }

    @Test
    void genericFilesGetAnExactDigest() throws IOException {
        Path file = Files.writeString(dir.resolve("notes.txt"), "hello");

        assertThat(engine.fingerprint(entryFor(file))).hasValueSatisfying(record -> {
            assertThat(record.getKind()).isEqualTo(FileKind.GENERIC);
            assertThat(record.getFingerprint()).isEqualTo("5d41402abc4b2a76b9719d911017c592");
            assertThat(record.getSize()).isEqualTo(5);
            assertThat(record.getPath()).isEqualTo(file);
        });
    }

    @Test
    void imagesGetAPerceptualHash() throws IOException {
        Path file = TestImages.write(TestImages.blocks(11), "png", dir.resolve("photo.PNG"));

        assertThat(engine.fingerprint(entryFor(file))).hasValueSatisfying(record -> {
            assertThat(record.getKind()).isEqualTo(FileKind.IMAGE);
            assertThat(record.getFingerprint()).hasSize(14);
        });
    }

    @Test
    void emptyFilesAreExcluded() throws IOException {
        Path file = Files.createFile(dir.resolve("empty.txt"));

        assertThat(engine.fingerprint(entryFor(file))).isEmpty();
    }

    @Test
    void undecodableImagesAreExcluded() throws IOException {
        Path file = Files.writeString(dir.resolve("broken.jpg"), "definitely not a jpeg");

        assertThat(engine.fingerprint(entryFor(file))).isEmpty();
    }

    @Test
    void vanishedFilesAreExcluded() throws IOException {
        Path file = Files.writeString(dir.resolve("soon-gone.txt"), "bye");
        ScanEntry entry = entryFor(file);
        Files.delete(file);

        assertThat(engine.fingerprint(entry)).isEmpty();
    }
}
