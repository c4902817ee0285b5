package com.sandkev.organizer;

import lombok.Value;

/**
 * Tally of one organize run; every image counted is either organized or skipped.
 */
@Value
public class OrganizeResult {
    int totalImages;
    int organizedImages;
    int skippedImages;
}
