package com.sandkev.PhotoSweep;

/**
 * Raised when a sweep stops at a checkpoint because cancellation was requested.
 */
public class SweepCancelledException extends RuntimeException {

    public SweepCancelledException(String message) {
        super(message);
    }
}
