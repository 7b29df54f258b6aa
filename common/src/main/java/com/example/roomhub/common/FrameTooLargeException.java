package com.example.roomhub.common;

import java.io.IOException;

/** Declared frame length exceeds the configured limit; the stream can no longer be trusted. */
public final class FrameTooLargeException extends IOException {
    private final long declaredLength;
    private final int maxLength;

    public FrameTooLargeException(long declaredLength, int maxLength) {
        super("frame of " + declaredLength + " bytes exceeds limit of " + maxLength);
        this.declaredLength = declaredLength;
        this.maxLength = maxLength;
    }

    public long declaredLength() { return declaredLength; }
    public int maxLength() { return maxLength; }
}
