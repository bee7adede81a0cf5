package com.example.sheetstream.exception;

/**
 * Thrown when a stream writer is used after it was finalized, or when a
 * second writer is opened on a sheet that is already being streamed.
 */
public class StreamStateException extends SheetStreamException {

    public StreamStateException(String message) {
        super(message);
    }
}
