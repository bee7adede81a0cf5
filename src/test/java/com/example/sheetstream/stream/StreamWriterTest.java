package com.example.sheetstream.stream;

import com.example.sheetstream.config.StreamingProperties;
import com.example.sheetstream.exception.InvalidCellReferenceException;
import com.example.sheetstream.exception.SheetNotFoundException;
import com.example.sheetstream.exception.StreamStateException;
import com.example.sheetstream.exception.WorksheetSerializationException;
import com.example.sheetstream.model.Columns;
import com.example.sheetstream.model.MergeCells;
import com.example.sheetstream.model.WorksheetModel;
import com.example.sheetstream.service.SpreadsheetDocument;
import com.example.sheetstream.service.WorksheetSerializer;
import com.example.sheetstream.util.CellReferences;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Streaming a worksheet")
public class StreamWriterTest {

    @TempDir
    Path tempDir;

    private SpreadsheetDocument newDocument(int spillThreshold) {
        return newDocument(spillThreshold, tempDir);
    }

    private SpreadsheetDocument newDocument(int spillThreshold, Path spillDirectory) {
        StreamingProperties properties = new StreamingProperties(spillThreshold, spillDirectory.toString(), "sheetstream-test-");
        return new SpreadsheetDocument(properties, new WorksheetSerializer());
    }

    private static String part(SpreadsheetDocument document, String partName) {
        byte[] part = document.getPart(partName).orElseThrow(() -> new AssertionError("missing part " + partName));
        return new String(part, StandardCharsets.UTF_8);
    }

    private static String sheetData(String part) {
        int start = part.indexOf("<sheetData>");
        int end = part.indexOf("</sheetData>");
        assertTrue(start >= 0 && end > start, "part has no streamed sheetData: " + part);
        return part.substring(start, end + "</sheetData>".length());
    }

    private long spillFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.count();
        }
    }

    private static void writeRows(StreamWriter writer, int rows) {
        for (int row = 1; row <= rows; row++) {
            writer.setRow(CellReferences.toCellName(1, row),
                    Arrays.asList(row, "row " + row, row % 2 == 0, row * 0.5d, null, " padded "));
        }
    }

    @Test
    @DisplayName("A single integer cell")
    public void testSingleIntegerCell() {
        SpreadsheetDocument document = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        StreamWriter writer = document.newStreamWriter("Sheet1");

        writer.setRow("A1", List.of(42));
        writer.flush();

        assertEquals("<sheetData><row r=\"1\"><c r=\"A1\"><v>42</v></c></row></sheetData>",
                sheetData(part(document, "xl/worksheets/sheet1.xml")));
        assertEquals(StreamState.FINALIZED, writer.getState());
    }

    @Test
    @DisplayName("Leading and trailing spaces are preserved")
    public void testPreservedSpaces() {
        SpreadsheetDocument document = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        StreamWriter writer = document.newStreamWriter("Sheet1");

        writer.setRow("A1", List.of(" hi "));
        writer.flush();

        assertTrue(part(document, writer.getPartName())
                .contains("<c r=\"A1\" t=\"str\" xml:space=\"preserve\"><v> hi </v></c>"));
    }

    @Test
    @DisplayName("Mismatched styles leave the buffer untouched")
    public void testMismatchedStylesDoNotWrite() {
        SpreadsheetDocument document = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        StreamWriter writer = document.newStreamWriter("Sheet1");

        assertThrows(IllegalArgumentException.class, () -> writer.setRow("A1", List.of(1, 2, 3), List.of(1, 2)));
        writer.flush();

        assertEquals("<sheetData></sheetData>", sheetData(part(document, writer.getPartName())));
    }

    @Test
    @DisplayName("A failing cell leaves no partial row")
    public void testFailingCellLeavesNoPartialRow() {
        SpreadsheetDocument document = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        StreamWriter writer = document.newStreamWriter("Sheet1");

        writer.setRow("A1", List.of("kept"));
        assertThrows(RuntimeException.class, () -> writer.setRow("A2", List.of("lost", LocalDate.of(1800, 1, 1))));
        assertThrows(InvalidCellReferenceException.class, () -> writer.setRow("A0", List.of("lost")));
        writer.flush();

        assertEquals("<sheetData><row r=\"1\"><c r=\"A1\" t=\"str\"><v>kept</v></c></row></sheetData>",
                sheetData(part(document, writer.getPartName())));
    }

    @Test
    @DisplayName("Spilling does not change the output")
    public void testSpillIsTransparent() throws IOException {
        SpreadsheetDocument inMemory = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        StreamWriter memoryWriter = inMemory.newStreamWriter("Sheet1");
        writeRows(memoryWriter, 500);
        memoryWriter.flush();

        SpreadsheetDocument spilled = newDocument(16);
        StreamWriter spillingWriter = spilled.newStreamWriter("Sheet1");
        writeRows(spillingWriter, 250);
        assertEquals(1, spillFiles());
        for (int row = 251; row <= 500; row++) {
            spillingWriter.setRow(CellReferences.toCellName(1, row),
                    Arrays.asList(row, "row " + row, row % 2 == 0, row * 0.5d, null, " padded "));
        }
        spillingWriter.flush();

        assertArrayEquals(inMemory.getPart("xl/worksheets/sheet1.xml").orElseThrow(),
                spilled.getPart("xl/worksheets/sheet1.xml").orElseThrow());
        assertEquals(0, spillFiles());
        assertFalse(spillingWriter.isDegraded());
    }

    @Test
    @DisplayName("Rows stay in memory when the spill directory is missing")
    public void testDegradedModeKeepsOutput() {
        SpreadsheetDocument inMemory = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        StreamWriter memoryWriter = inMemory.newStreamWriter("Sheet1");
        writeRows(memoryWriter, 50);
        memoryWriter.flush();

        SpreadsheetDocument degraded = newDocument(16, tempDir.resolve("does-not-exist"));
        StreamWriter degradedWriter = degraded.newStreamWriter("Sheet1");
        writeRows(degradedWriter, 50);
        assertTrue(degradedWriter.isDegraded());
        degradedWriter.flush();

        assertArrayEquals(inMemory.getPart("xl/worksheets/sheet1.xml").orElseThrow(),
                degraded.getPart("xl/worksheets/sheet1.xml").orElseThrow());
    }

    @Test
    @DisplayName("The streamed rows replace only the row data of the worksheet")
    public void testSplicesIntoWorksheetModel() {
        SpreadsheetDocument document = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        WorksheetModel model = document.getWorksheetModel("Sheet1");
        Columns cols = new Columns();
        cols.getColumns().add(Columns.Column.builder().min(1).max(2).width(20d).customWidth(true).build());
        model.setCols(cols);
        model.setMergeCells(new MergeCells().add("A1:B1"));

        StreamWriter writer = document.newStreamWriter("Sheet1");
        writer.setRow("A1", List.of("Title"));
        writer.setRow("A2", List.of(1, 2));
        writer.flush();

        String part = part(document, writer.getPartName());
        assertTrue(part.startsWith(WorksheetSerializer.XML_HEADER + WorksheetSerializer.WORKSHEET_START));
        assertTrue(part.endsWith("</worksheet>"));
        int colsAt = part.indexOf("<cols>");
        int sheetDataAt = part.indexOf("<sheetData>");
        int mergeCellsAt = part.indexOf("<mergeCells");
        int pageMarginsAt = part.indexOf("<pageMargins");
        assertTrue(colsAt > 0 && colsAt < sheetDataAt, part);
        assertTrue(sheetDataAt < mergeCellsAt && mergeCellsAt < pageMarginsAt, part);
        assertEquals(1, part.split("<sheetData>", -1).length - 1);
        assertEquals(1, part.split("</sheetData>", -1).length - 1);
        assertEquals("<sheetData><row r=\"1\"><c r=\"A1\" t=\"str\"><v>Title</v></c></row>"
                + "<row r=\"2\"><c r=\"A2\"><v>1</v></c><c r=\"B2\"><v>2</v></c></row></sheetData>", sheetData(part));
    }

    @Test
    @DisplayName("A finalized writer rejects further use")
    public void testFinalizedWriterRejectsWrites() {
        SpreadsheetDocument document = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        StreamWriter writer = document.newStreamWriter("Sheet1");
        writer.flush();

        assertThrows(StreamStateException.class, () -> writer.setRow("A1", List.of(1)));
        assertThrows(StreamStateException.class, writer::flush);
        writer.close();
    }

    @Test
    @DisplayName("Only one writer per sheet at a time")
    public void testOneWriterPerSheet() {
        SpreadsheetDocument document = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        document.newSheet("Data");
        StreamWriter first = document.newStreamWriter("Sheet1");

        assertThrows(StreamStateException.class, () -> document.newStreamWriter("sheet1"));
        assertTrue(document.isStreaming("Sheet1"));
        StreamWriter other = document.newStreamWriter("Data");
        other.close();

        first.close();
        assertFalse(document.isStreaming("Sheet1"));
        StreamWriter second = document.newStreamWriter("Sheet1");
        second.setRow("A1", List.of(1));
        second.flush();
        assertTrue(document.getPart("xl/worksheets/sheet1.xml").isPresent());
    }

    @Test
    @DisplayName("Unknown sheets cannot be streamed")
    public void testUnknownSheet() {
        SpreadsheetDocument document = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        SheetNotFoundException ex = assertThrows(SheetNotFoundException.class, () -> document.newStreamWriter("Nope"));
        assertEquals("Nope", ex.getSheetName());
    }

    @Test
    @DisplayName("Deleting the sheet while streaming fails the flush and removes the spill file")
    public void testSheetDeletedWhileStreaming() throws IOException {
        SpreadsheetDocument document = newDocument(16);
        document.newSheet("Data");
        StreamWriter writer = document.newStreamWriter("Data");
        writeRows(writer, 20);
        assertEquals(1, spillFiles());

        document.deleteSheet("Data");

        assertThrows(SheetNotFoundException.class, writer::flush);
        assertEquals(StreamState.FINALIZED, writer.getState());
        assertEquals(0, spillFiles());
        assertFalse(document.getPart("xl/worksheets/sheet2.xml").isPresent());
    }

    @Test
    @DisplayName("A sheet re-created under the same name is a different sheet")
    public void testSheetRecreatedWhileStreaming() {
        SpreadsheetDocument document = newDocument(StreamingProperties.DEFAULT_SPILL_THRESHOLD);
        document.newSheet("Data");
        StreamWriter writer = document.newStreamWriter("Data");
        document.deleteSheet("Data");
        document.newSheet("Data");

        assertThrows(SheetNotFoundException.class, writer::flush);
    }

    @Test
    @DisplayName("Closing without flushing discards the rows")
    public void testCloseWithoutFlush() throws IOException {
        SpreadsheetDocument document = newDocument(16);
        try (StreamWriter writer = document.newStreamWriter("Sheet1")) {
            writeRows(writer, 20);
            assertEquals(1, spillFiles());
        }

        assertEquals(0, spillFiles());
        assertFalse(document.getPart("xl/worksheets/sheet1.xml").isPresent());
        assertFalse(document.isStreaming("Sheet1"));
    }

    @Test
    @DisplayName("Serialization failures surface and still clean up")
    public void testSerializationFailure() throws IOException {
        WorksheetSerializer serializer = mock(WorksheetSerializer.class);
        when(serializer.serialize(any(WorksheetModel.class), anyMap()))
                .thenThrow(new WorksheetSerializationException("cols", "boom", null));
        StreamingProperties properties = new StreamingProperties(16, tempDir.toString(), "sheetstream-test-");
        SpreadsheetDocument document = new SpreadsheetDocument(properties, serializer);

        StreamWriter writer = document.newStreamWriter("Sheet1");
        writeRows(writer, 20);

        WorksheetSerializationException ex = assertThrows(WorksheetSerializationException.class, writer::flush);
        assertEquals("cols", ex.getFieldName());
        assertEquals(0, spillFiles());
        assertFalse(document.isStreaming("Sheet1"));
        assertFalse(document.getPart("xl/worksheets/sheet1.xml").isPresent());
    }
}
