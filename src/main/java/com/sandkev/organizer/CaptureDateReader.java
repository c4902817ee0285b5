package com.sandkev.organizer;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;

public interface CaptureDateReader {

    /**
     * @return the date the picture was taken, empty when the image carries none or cannot be read
     */
    Optional<LocalDate> captureDate(Path image);
}
