package com.example.sheetstream.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning for streamed worksheets.
 *
 * Example application.yml:
 *
 * sheetstream:
 *   streaming:
 *     spill-threshold: 16777216
 *     temp-directory: /var/tmp/sheets
 *     temp-file-prefix: "sheetstream-"
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "sheetstream.streaming")
public class StreamingProperties {

    public static final int DEFAULT_SPILL_THRESHOLD = 1 << 24;

    /**
     * Buffered row data size in bytes at which the buffer is moved to a temporary file
     */
    private int spillThreshold = DEFAULT_SPILL_THRESHOLD;

    /**
     * Directory for spill files (optional, defaults to the platform temporary directory)
     */
    private String tempDirectory;

    /**
     * Name prefix of spill files
     */
    private String tempFilePrefix = "sheetstream-";

}
