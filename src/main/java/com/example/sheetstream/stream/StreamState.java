package com.example.sheetstream.stream;

public enum StreamState {
    /**
     * Accepting rows
     */
    OPEN,
    /**
     * Flushed or closed; terminal
     */
    FINALIZED
}
