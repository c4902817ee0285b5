package com.sandkev.organizer;

import java.time.LocalDate;
import java.util.Locale;
import java.util.function.Function;

/**
 * How a capture date becomes the name of the folder an image is moved into.
 */
public enum OrganizeMode {

    /** ISO date, e.g. 2024-01-15 */
    DATE("date", LocalDate::toString),
    /** year and quarter, e.g. 2024-Q1 */
    QUARTER("quarter", date -> date.getYear() + "-Q" + ((date.getMonthValue() - 1) / 3 + 1));

    private final String token;
    private final Function<LocalDate, String> folderKey;

    OrganizeMode(String token, Function<LocalDate, String> folderKey) {
        this.token = token;
        this.folderKey = folderKey;
    }

    public String getToken() {
        return token;
    }

    public String folderKey(LocalDate date) {
        return folderKey.apply(date);
    }

    /**
     * Unknown or missing names fall back to {@link #DATE}.
     */
    public static OrganizeMode fromName(String name) {
        if (name != null) {
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            for (OrganizeMode mode : values()) {
                if (mode.token.equals(wanted)) {
                    return mode;
                }
            }
        }
        return DATE;
    }
}
