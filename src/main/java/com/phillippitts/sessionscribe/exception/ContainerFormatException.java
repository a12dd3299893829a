package com.phillippitts.sessionscribe.exception;

/**
 * Thrown when an Ogg stream is structurally invalid (bad capture pattern or checksum mismatch).
 * A truncated trailing page is not an error.
 */
public class ContainerFormatException extends SessionScribeException {

    private final long offset;

    public ContainerFormatException(String message, long offset) {
        super(message + " at byte offset " + offset);
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }
}
