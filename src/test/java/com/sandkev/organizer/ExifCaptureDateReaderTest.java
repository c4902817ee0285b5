package com.sandkev.organizer;

import com.sandkev.PhotoSweep.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ExifCaptureDateReaderTest {

    @TempDir
    Path dir;

    @Test
    void parsesIsoAndRawExifForms() {
        assertThat(ExifCaptureDateReader.parseDate("2021-06-30T18:01:02")).contains(LocalDate.of(2021, 6, 30));
        assertThat(ExifCaptureDateReader.parseDate("2019:12:25 08:00:00")).contains(LocalDate.of(2019, 12, 25));
    }

    @Test
    void ignoresMissingOrMalformedDates() {
        assertThat(ExifCaptureDateReader.parseDate(null)).isEmpty();
        assertThat(ExifCaptureDateReader.parseDate("2019")).isEmpty();
        assertThat(ExifCaptureDateReader.parseDate("0000:00:00 00:00:00")).isEmpty();
        assertThat(ExifCaptureDateReader.parseDate("yesterday morning")).isEmpty();
    }

    @Test
    void readsDateTimeOriginalFromAJpeg() throws IOException {
        Path jpeg = TestImages.jpegTakenAt(TestImages.blocks(5), "2018:08:20 14:30:00", dir.resolve("camera.jpg"));

        assertThat(new ExifCaptureDateReader().captureDate(jpeg)).contains(LocalDate.of(2018, 8, 20));
    }

    @Test
    void imageWithoutExifHasNoCaptureDate() throws IOException {
        Path png = TestImages.write(TestImages.blocks(4), "png", dir.resolve("plain.png"));

        assertThat(new ExifCaptureDateReader().captureDate(png)).isEmpty();
    }

    @Test
    void unreadableFileHasNoCaptureDate() throws IOException {
        Path junk = Files.writeString(dir.resolve("junk.jpg"), "not an image at all");

        assertThat(new ExifCaptureDateReader().captureDate(junk)).isEmpty();
        assertThat(new ExifCaptureDateReader().captureDate(dir.resolve("missing.jpg"))).isEmpty();
    }
}
