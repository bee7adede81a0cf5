package com.example.sheetstream.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Used range of the sheet, e.g. "A1:C10".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "dimension")
public class SheetDimension {

    @JacksonXmlProperty(isAttribute = true)
    private String ref;
}
