package com.sandkev.PhotoSweep;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DuplicateFileFinderTest {

    @TempDir
    Path root;

    private final DuplicateFileFinder finder = new DuplicateFileFinder(4);

    @Test
    void byteIdenticalFilesFormOneClass() throws Exception {
        for (int i = 0; i < 4; i++) {
            Path folder = Files.createDirectories(root.resolve("dir" + i));
            Files.writeString(folder.resolve("report.pdf"), "the same bytes everywhere");
        }
        Files.writeString(root.resolve("other.pdf"), "something else");

        Duplicates duplicates = finder.scan(root);

        assertThat(duplicates.getImageDuplicates().isEmpty()).isTrue();
        assertThat(duplicates.getGenericDuplicates().keySet()).hasSize(1);
        assertThat(duplicates.getGenericDuplicates().values()).hasSize(4)
                .allMatch(record -> record.getPath().endsWith("report.pdf"));
    }

    @Test
    void resavedImagesFormOneClass() throws Exception {
        BufferedImage picture = TestImages.blocks(21);
        TestImages.write(picture, "png", root.resolve("holiday.png"));
        TestImages.write(picture, "png", root.resolve("backup/holiday-copy.png"));
        TestImages.write(picture, "bmp", root.resolve("export/holiday.bmp"));
        TestImages.write(TestImages.blocks(22), "png", root.resolve("another.png"));

        Duplicates duplicates = finder.scan(root);

        assertThat(duplicates.getImageDuplicates().keySet()).hasSize(1);
        assertThat(duplicates.getImageDuplicates().values())
                .extracting(record -> record.getPath().getFileName().toString())
                .containsExactlyInAnyOrder("holiday.png", "holiday-copy.png", "holiday.bmp");
        assertThat(duplicates.getGenericDuplicates().isEmpty()).isTrue();
    }

    @Test
    void distinctFilesHaveNoDuplicates() throws Exception {
        for (int i = 0; i < 6; i++) {
            Files.writeString(root.resolve("file" + i + ".txt"), "unique " + i);
            TestImages.write(TestImages.blocks(100 + i), "png", root.resolve("pic" + i + ".png"));
        }

        assertThat(finder.scan(root).isEmpty()).isTrue();
    }

    @Test
    void emptyFilesNeverShowUp() throws Exception {
        Files.createFile(root.resolve("a.txt"));
        Files.createFile(root.resolve("b.txt"));
        Files.createFile(root.resolve("c.jpg"));

        ScanResult fingerprints = finder.fingerprint(root, ScanListener.NONE);

        assertThat(fingerprints.getListedEntries()).isEqualTo(3);
        assertThat(fingerprints.getRecordCount()).isZero();
        assertThat(finder.scan(root).isEmpty()).isTrue();
    }

    @Test
    void scanningTwiceGivesTheSameFingerprints() throws Exception {
        Files.writeString(root.resolve("x.txt"), "x");
        Files.writeString(root.resolve("y.txt"), "x");
        TestImages.write(TestImages.blocks(5), "png", root.resolve("p.png"));

        ScanResult first = finder.fingerprint(root, ScanListener.NONE);
        ScanResult second = finder.fingerprint(root, ScanListener.NONE);

        assertThat(second.getGenericFingerprints().keySet()).isEqualTo(first.getGenericFingerprints().keySet());
        assertThat(second.getImageFingerprints().keySet()).isEqualTo(first.getImageFingerprints().keySet());
    }

    @Test
    void rejectsMissingDirectory() {
        assertThatThrownBy(() -> finder.scan(root.resolve("nope")))
                .isInstanceOf(NotDirectoryException.class);
    }

    @Test
    void rejectsPlainFile() throws IOException {
        Path file = Files.writeString(root.resolve("file.txt"), "x");

        assertThatThrownBy(() -> finder.scan(file)).isInstanceOf(NotDirectoryException.class);
    }
}
