package com.example.sheetstream.stream;

import com.example.sheetstream.exception.CellValueConversionException;
import com.fasterxml.jackson.core.io.schubfach.DoubleToDecimal;
import com.fasterxml.jackson.core.io.schubfach.FloatToDecimal;
import org.apache.poi.ss.usermodel.DateUtil;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Calendar;
import java.util.Date;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps runtime values to encoded cells.
 *
 * Every value resolves to exactly one cell type: integers, floating point
 * numbers, durations and timestamps become numeric cells, booleans become
 * boolean cells, and text, {@code null} and any other object become string
 * cells. The only failure is a timestamp outside the range of serial dates.
 */
public class CellValueEncoder {

    /**
     * Maximum number of characters a cell can contain
     */
    public static final int MAX_CELL_TEXT_LENGTH = 32767;

    private static final double SECONDS_PER_DAY = 86400d;
    private static final int MAX_YEAR = 9999;

    private final boolean date1904;

    public CellValueEncoder() {
        this(false);
    }

    /**
     * @param date1904 whether the workbook counts serial dates from 1904-01-01 instead of 1900-01-01
     */
    public CellValueEncoder(boolean date1904) {
        this.date1904 = date1904;
    }

    public EncodedCell encode(String cellName, int style, Object value) {
        if (value == null) {
            return text(cellName, style, "");
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger
                || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return number(cellName, style, value.toString());
        }
        if (value instanceof Float) {
            float f = (Float) value;
            if (!Float.isFinite(f)) {
                return text(cellName, style, value.toString());
            }
            return number(cellName, style, formatFloat(f));
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (!Double.isFinite(d)) {
                return text(cellName, style, value.toString());
            }
            return number(cellName, style, formatDouble(d));
        }
        if (value instanceof BigDecimal) {
            return number(cellName, style, ((BigDecimal) value).stripTrailingZeros().toPlainString());
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return text(cellName, style, value.toString());
        }
        if (value instanceof byte[]) {
            return text(cellName, style, new String((byte[]) value, StandardCharsets.UTF_8));
        }
        if (value instanceof Duration) {
            return number(cellName, style, formatFloat((float) toDays((Duration) value)));
        }
        if (value instanceof Boolean) {
            return EncodedCell.builder()
                    .cellName(cellName)
                    .style(style)
                    .type(CellType.BOOLEAN)
                    .value((Boolean) value ? "1" : "0")
                    .build();
        }
        LocalDateTime timestamp = toLocalDateTime(value);
        if (timestamp != null) {
            return number(cellName, style, formatDouble(toSerialDate(cellName, timestamp)));
        }
        return text(cellName, style, String.valueOf(value));
    }

    /**
     * Shortest decimal text that reads back as the same single-precision
     * value, in plain notation ("1.0E10" is written as "10000000000").
     */
    static String formatFloat(float value) {
        return plain(FloatToDecimal.toString(value));
    }

    /**
     * Double-precision counterpart of {@link #formatFloat(float)}. Digits come
     * from Jackson's Schubfach writer, since {@code Double.toString} is not
     * always shortest on this JDK (1.0E23 prints as 9.999999999999999E22).
     */
    static String formatDouble(double value) {
        return plain(DoubleToDecimal.toString(value));
    }

    private static String plain(String shortest) {
        return new BigDecimal(shortest).stripTrailingZeros().toPlainString();
    }

    private static double toDays(Duration duration) {
        return (duration.getSeconds() + duration.getNano() / 1_000_000_000d) / SECONDS_PER_DAY;
    }

    /**
     * Instants and {@link Date}s are taken at UTC; zoned values keep their own wall-clock time.
     */
    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDateTime();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof Date) {
            // java.sql.Date does not support toInstant()
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Date) value).getTime()), ZoneOffset.UTC);
        }
        if (value instanceof Calendar) {
            Calendar calendar = (Calendar) value;
            return LocalDateTime.ofInstant(calendar.toInstant(), calendar.getTimeZone().toZoneId());
        }
        return null;
    }

    private double toSerialDate(String cellName, LocalDateTime timestamp) {
        if (timestamp.getYear() > MAX_YEAR) {
            throw new CellValueConversionException(cellName, timestamp + " is after 9999-12-31");
        }
        double serial = DateUtil.getExcelDate(timestamp, date1904);
        if (serial < 0) {
            throw new CellValueConversionException(cellName,
                    timestamp + " is before the " + (date1904 ? "1904" : "1900") + " date system epoch");
        }
        return serial;
    }

    private static EncodedCell number(String cellName, int style, String value) {
        return EncodedCell.builder()
                .cellName(cellName)
                .style(style)
                .type(CellType.NUMBER)
                .value(value)
                .build();
    }

    private static EncodedCell text(String cellName, int style, String value) {
        String truncated = truncate(value);
        return EncodedCell.builder()
                .cellName(cellName)
                .style(style)
                .type(CellType.STRING)
                .value(truncated)
                .preserveSpace(hasLeadingOrTrailingSpace(truncated))
                .build();
    }

    static String truncate(String value) {
        if (value.length() <= MAX_CELL_TEXT_LENGTH) {
            return value;
        }
        int end = MAX_CELL_TEXT_LENGTH;
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    static boolean hasLeadingOrTrailingSpace(String value) {
        return !value.isEmpty() && (value.charAt(0) == ' ' || value.charAt(value.length() - 1) == ' ');
    }
}
