package com.example.sheetstream.stream;

import com.example.sheetstream.exception.SheetNotFoundException;
import com.example.sheetstream.exception.SpillFileException;
import com.example.sheetstream.exception.StreamStateException;
import com.example.sheetstream.model.WorksheetModel;
import com.example.sheetstream.service.SpreadsheetDocument;
import com.example.sheetstream.service.WorksheetSerializer;
import com.example.sheetstream.util.CellCoordinates;
import com.example.sheetstream.util.CellReferences;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the rows of one worksheet without building its cell model in memory.
 *
 * Rows are encoded as they arrive and buffered by a {@link SpillBuffer}, which
 * moves them to a temporary file once the buffer grows past the configured
 * threshold. {@link #flush()} splices the row data into the sheet's worksheet
 * model and installs the result as the sheet's part:
 *
 * <pre>
 * SpreadsheetDocument document = documentFactory.create();
 * try (StreamWriter writer = document.newStreamWriter("Sheet1")) {
 *     for (int row = 1; row &lt;= 102400; row++) {
 *         writer.setRow(CellReferences.toCellName(1, row), values(row));
 *     }
 *     writer.flush();
 * }
 * </pre>
 *
 * Rows must be written in ascending row order; this is not checked, and
 * out-of-order rows produce a worksheet that spreadsheet applications
 * reject. A writer is not thread-safe.
 */
@Slf4j
public class StreamWriter implements AutoCloseable {

    private static final String SHEET_DATA_START = "<sheetData>";
    private static final String SHEET_DATA_END = "</sheetData>";

    private final SpreadsheetDocument document;
    private final WorksheetSerializer serializer;
    @Getter
    private final String sheetName;
    @Getter
    private final int sheetIndex;
    private final SpillBuffer buffer;
    private final RowEncoder rowEncoder;
    @Getter
    private StreamState state = StreamState.OPEN;

    public StreamWriter(SpreadsheetDocument document, WorksheetSerializer serializer, String sheetName,
                        int sheetIndex, SpillBuffer buffer, CellValueEncoder cellEncoder) {
        this.document = document;
        this.serializer = serializer;
        this.sheetName = sheetName;
        this.sheetIndex = sheetIndex;
        this.buffer = buffer;
        this.rowEncoder = new RowEncoder(cellEncoder);
        buffer.append(SHEET_DATA_START);
    }

    public String getPartName() {
        return SpreadsheetDocument.worksheetPartName(sheetIndex);
    }

    /**
     * Whether row data had to stay in memory because it could not be spilled.
     */
    public boolean isDegraded() {
        return buffer.isDegraded();
    }

    /**
     * @see #setRow(String, List, List)
     */
    public void setRow(String cellName, List<?> values) {
        setRow(cellName, values, null);
    }

    /**
     * Write one row of values starting at {@code cellName}, one cell per value
     * in consecutive columns.
     *
     * @param cellName first cell of the row, e.g. "A1"
     * @param values   cell values
     * @param styles   style indices parallel to {@code values}; {@code null} or empty for the default style
     * @throws IllegalArgumentException if {@code styles} does not match {@code values} in size
     * @throws StreamStateException     if the writer was already flushed or closed
     */
    public void setRow(String cellName, List<?> values, List<Integer> styles) {
        ensureOpen();
        Objects.requireNonNull(values, "values");
        CellCoordinates start = CellReferences.parse(cellName);
        buffer.append(rowEncoder.encodeRow(start, values, styles));
        buffer.spillIfNeeded();
    }

    /**
     * End the stream and install the worksheet part in the document. The
     * writer is finalized afterwards, also when this fails, and the spill
     * file is always removed.
     *
     * @throws SheetNotFoundException if the sheet was deleted while streaming
     * @throws SpillFileException     if spilled rows cannot be read back
     */
    public void flush() {
        ensureOpen();
        state = StreamState.FINALIZED;
        try {
            buffer.append(SHEET_DATA_END);
            WorksheetModel model = currentWorksheetModel();
            String partName = getPartName();
            document.evictWorksheet(partName);

            boolean spilled = buffer.hasSpillFile();
            byte[] sheetData = buffer.drain();
            byte[] part = serializer.serialize(model, Map.of(WorksheetSerializer.SHEET_DATA, sheetData));
            document.putPart(partName, part);
            log.info("Flushed sheet {} to {} ({} bytes of row data, spilled: {}, degraded: {})",
                    sheetName, partName, sheetData.length, spilled, buffer.isDegraded());
        } catch (RuntimeException e) {
            discardAfterFailure(e);
            throw e;
        } finally {
            document.releaseStreamLease(sheetIndex);
        }
    }

    /**
     * Abandon an unflushed stream: buffered rows and the spill file are
     * dropped and the document is left untouched. Does nothing after
     * {@link #flush()}.
     */
    @Override
    public void close() {
        if (state == StreamState.FINALIZED) {
            return;
        }
        state = StreamState.FINALIZED;
        try {
            buffer.discard();
            log.debug("Closed stream writer on sheet {} without flushing", sheetName);
        } finally {
            document.releaseStreamLease(sheetIndex);
        }
    }

    private WorksheetModel currentWorksheetModel() {
        int current = document.findSheetIndex(sheetName).orElseThrow(() -> new SheetNotFoundException(sheetName));
        if (current != sheetIndex) {
            // deleted and re-created under the same name
            throw new SheetNotFoundException(sheetName);
        }
        return document.getWorksheetModel(sheetName);
    }

    private void discardAfterFailure(RuntimeException failure) {
        try {
            buffer.discard();
        } catch (SpillFileException e) {
            failure.addSuppressed(e);
        }
    }

    private void ensureOpen() {
        if (state != StreamState.OPEN) {
            throw new StreamStateException("stream writer on sheet " + sheetName + " is already finalized");
        }
    }
}
