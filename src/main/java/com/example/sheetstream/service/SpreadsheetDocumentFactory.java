package com.example.sheetstream.service;

import com.example.sheetstream.config.StreamingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates documents wired with the configured streaming properties.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpreadsheetDocumentFactory {
    private final StreamingProperties properties;
    private final WorksheetSerializer serializer;

    public SpreadsheetDocument create() {
        log.debug("Creating spreadsheet document (spill threshold {} bytes)", properties.getSpillThreshold());
        return new SpreadsheetDocument(properties, serializer);
    }
}
