package com.example.sheetstream.stream;

import com.example.sheetstream.util.XmlText;
import lombok.Builder;
import lombok.Value;

/**
 * One encoded cell, ready to be written as a {@code <c>} element.
 */
@Value
@Builder
public class EncodedCell {
    String cellName;
    int style;
    CellType type;
    /**
     * Literal value text; empty for blank string cells
     */
    String value;
    boolean preserveSpace;

    /**
     * Append the {@code <c>} element. Style 0, the numeric type and an empty
     * value are omitted.
     */
    public void appendTo(StringBuilder out) {
        out.append("<c r=\"").append(cellName).append('"');
        if (style != 0) {
            out.append(" s=\"").append(style).append('"');
        }
        if (type.getCode() != null) {
            out.append(" t=\"").append(type.getCode()).append('"');
        }
        if (preserveSpace) {
            out.append(" xml:space=\"preserve\"");
        }
        out.append('>');
        if (value != null && !value.isEmpty()) {
            out.append("<v>");
            XmlText.appendEscaped(value, out);
            out.append("</v>");
        }
        out.append("</c>");
    }

    public String toMarkup() {
        StringBuilder out = new StringBuilder(48);
        appendTo(out);
        return out.toString();
    }
}
