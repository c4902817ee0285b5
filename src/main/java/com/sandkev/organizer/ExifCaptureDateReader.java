package com.sandkev.organizer;

import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TIFF;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads the EXIF DateTimeOriginal tag through Tika's image parsers.
 */
@Slf4j
public class ExifCaptureDateReader implements CaptureDateReader {

    private final Parser parser;

    public ExifCaptureDateReader() {
        this(new AutoDetectParser());
    }

    public ExifCaptureDateReader(Parser parser) {
        this.parser = parser;
    }

    @Override
    public Optional<LocalDate> captureDate(Path image) {
        Metadata metadata = new Metadata();
        try (InputStream stream = TikaInputStream.get(image, metadata)) {
            parser.parse(stream, new DefaultHandler(), metadata, new ParseContext());
        } catch (IOException | SAXException | TikaException | RuntimeException e) {
            log.debug("unable to read exif from {}: {}", image, e.toString());
            return Optional.empty();
        }
        return parseDate(metadata.get(TIFF.ORIGINAL_DATE));
    }

    /**
     * Accepts both the ISO form Tika reports ({@code 2024-01-15T10:20:30}) and the raw
     * EXIF form ({@code 2024:01:15 10:20:30}); only the date part is used.
     */
    static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.length() < 10) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.substring(0, 10).replace(':', '-')));
        } catch (DateTimeParseException e) {
            log.debug("ignoring malformed capture date '{}'", value);
            return Optional.empty();
        }
    }
}
