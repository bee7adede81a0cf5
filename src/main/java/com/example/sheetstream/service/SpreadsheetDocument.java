package com.example.sheetstream.service;

import com.example.sheetstream.config.StreamingProperties;
import com.example.sheetstream.exception.SheetNotFoundException;
import com.example.sheetstream.exception.StreamStateException;
import com.example.sheetstream.model.PageMargins;
import com.example.sheetstream.model.SheetFormatProperties;
import com.example.sheetstream.model.SheetViews;
import com.example.sheetstream.model.WorksheetModel;
import com.example.sheetstream.stream.CellValueEncoder;
import com.example.sheetstream.stream.SpillBuffer;
import com.example.sheetstream.stream.StreamWriter;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * In-memory spreadsheet document: a registry of sheets, the worksheet models
 * loaded so far, and the serialized parts ready for packaging.
 *
 * Sheets are numbered from 1 in creation order and their worksheet part is
 * {@code xl/worksheets/sheet{index}.xml}. Sheet names are matched
 * case-insensitively, as spreadsheet applications do.
 *
 * Not thread-safe.
 */
@Slf4j
public class SpreadsheetDocument {

    public static final String DEFAULT_SHEET_NAME = "Sheet1";

    private static final int MAX_SHEET_NAME_LENGTH = 31;
    private static final String INVALID_SHEET_NAME_CHARS = ":\\/?*[]";

    private final StreamingProperties properties;
    private final WorksheetSerializer serializer;

    private final Map<String, SheetEntry> sheets = new LinkedHashMap<>();
    private final Map<String, WorksheetModel> worksheets = new HashMap<>();
    private final Map<String, byte[]> parts = new LinkedHashMap<>();
    private final Set<String> streamedParts = new HashSet<>();
    private int nextSheetIndex = 1;

    /**
     * Whether serial dates count from 1904-01-01 instead of 1900-01-01
     */
    @Getter
    @Setter
    private boolean date1904;

    public SpreadsheetDocument(StreamingProperties properties, WorksheetSerializer serializer) {
        this.properties = properties;
        this.serializer = serializer;
        newSheet(DEFAULT_SHEET_NAME);
    }

    public static String worksheetPartName(int sheetIndex) {
        return "xl/worksheets/sheet" + sheetIndex + ".xml";
    }

    /**
     * Create a sheet with an empty worksheet, or return the index of the
     * existing sheet of that name.
     *
     * @return the 1-based sheet index
     */
    public int newSheet(String name) {
        validateSheetName(name);
        SheetEntry existing = sheets.get(key(name));
        if (existing != null) {
            return existing.index;
        }
        SheetEntry entry = new SheetEntry(name, nextSheetIndex++);
        sheets.put(key(name), entry);
        worksheets.put(entry.partName(), newWorksheet());
        log.debug("Created sheet {} as {}", name, entry.partName());
        return entry.index;
    }

    /**
     * Remove a sheet together with its worksheet model and part.
     *
     * @throws SheetNotFoundException if the sheet does not exist
     */
    public void deleteSheet(String name) {
        SheetEntry entry = sheets.remove(key(name));
        if (entry == null) {
            throw new SheetNotFoundException(name);
        }
        worksheets.remove(entry.partName());
        parts.remove(entry.partName());
        log.debug("Deleted sheet {}", entry.name);
    }

    public OptionalInt findSheetIndex(String name) {
        SheetEntry entry = name == null ? null : sheets.get(key(name));
        return entry == null ? OptionalInt.empty() : OptionalInt.of(entry.index);
    }

    public List<String> getSheetNames() {
        List<String> names = new ArrayList<>();
        for (SheetEntry entry : sheets.values()) {
            names.add(entry.name);
        }
        return names;
    }

    /**
     * Return the mutable worksheet model of a sheet, parsing it from its part
     * when it is not loaded (e.g. after the sheet was streamed).
     *
     * @throws SheetNotFoundException if the sheet does not exist
     */
    public WorksheetModel getWorksheetModel(String name) {
        SheetEntry entry = requireSheet(name);
        return worksheets.computeIfAbsent(entry.partName(), partName -> {
            byte[] part = parts.get(partName);
            if (part == null) {
                return newWorksheet();
            }
            log.debug("Loading worksheet model of sheet {} from {}", entry.name, partName);
            return serializer.deserialize(part);
        });
    }

    /**
     * Open a stream writer on a sheet. The writer holds an exclusive lease
     * on the sheet until it is flushed or closed.
     *
     * @throws SheetNotFoundException if the sheet does not exist
     * @throws StreamStateException   if another writer on the sheet is still open
     */
    public StreamWriter newStreamWriter(String name) {
        SheetEntry entry = requireSheet(name);
        String partName = entry.partName();
        if (!streamedParts.add(partName)) {
            throw new StreamStateException("sheet " + entry.name + " already has an open stream writer");
        }
        try {
            SpillBuffer buffer = new SpillBuffer(properties.getSpillThreshold(),
                    tempDirectory(), properties.getTempFilePrefix());
            StreamWriter writer = new StreamWriter(this, serializer, entry.name, entry.index, buffer,
                    new CellValueEncoder(date1904));
            log.debug("Opened stream writer on sheet {} ({})", entry.name, partName);
            return writer;
        } catch (RuntimeException e) {
            streamedParts.remove(partName);
            throw e;
        }
    }

    /**
     * Give up the lease taken by {@link #newStreamWriter(String)}.
     */
    public void releaseStreamLease(int sheetIndex) {
        if (streamedParts.remove(worksheetPartName(sheetIndex))) {
            log.debug("Released stream lease on {}", worksheetPartName(sheetIndex));
        }
    }

    public boolean isStreaming(String name) {
        SheetEntry entry = sheets.get(key(name));
        return entry != null && streamedParts.contains(entry.partName());
    }

    /**
     * Drop the loaded model of a part so that it no longer overrides the
     * part's serialized content.
     */
    public void evictWorksheet(String partName) {
        worksheets.remove(partName);
    }

    /**
     * Install serialized content for a part, replacing any previous content.
     */
    public void putPart(String partName, byte[] content) {
        parts.put(partName, content);
    }

    public Optional<byte[]> getPart(String partName) {
        return Optional.ofNullable(parts.get(partName));
    }

    public Set<String> getPartNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(parts.keySet()));
    }

    /**
     * Serialize every loaded worksheet model into its part. Streamed sheets
     * are not loaded and keep their streamed part.
     */
    public void writeWorksheetParts() {
        for (Map.Entry<String, WorksheetModel> worksheet : worksheets.entrySet()) {
            parts.put(worksheet.getKey(), serializer.serialize(worksheet.getValue()));
        }
        log.debug("Wrote {} worksheet part(s)", worksheets.size());
    }

    private SheetEntry requireSheet(String name) {
        SheetEntry entry = name == null ? null : sheets.get(key(name));
        if (entry == null) {
            throw new SheetNotFoundException(name);
        }
        return entry;
    }

    private Path tempDirectory() {
        String directory = properties.getTempDirectory();
        return directory == null || directory.isBlank() ? null : Paths.get(directory);
    }

    private static WorksheetModel newWorksheet() {
        SheetViews views = new SheetViews();
        views.getViews().add(SheetViews.SheetView.builder().build());
        return WorksheetModel.builder()
                .sheetViews(views)
                .sheetFormatPr(SheetFormatProperties.builder().build())
                .pageMargins(PageMargins.builder().build())
                .build();
    }

    private static void validateSheetName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("sheet name must not be blank");
        }
        if (name.length() > MAX_SHEET_NAME_LENGTH) {
            throw new IllegalArgumentException("sheet name must not exceed " + MAX_SHEET_NAME_LENGTH
                    + " characters: " + name);
        }
        for (char c : name.toCharArray()) {
            if (INVALID_SHEET_NAME_CHARS.indexOf(c) >= 0) {
                throw new IllegalArgumentException("sheet name must not contain '" + c + "': " + name);
            }
        }
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static final class SheetEntry {
        private final String name;
        private final int index;

        private SheetEntry(String name, int index) {
            this.name = name;
            this.index = index;
        }

        private String partName() {
            return worksheetPartName(index);
        }
    }
}
