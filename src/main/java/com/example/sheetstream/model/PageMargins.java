package com.example.sheetstream.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Page margins in inches. Defaults match a new workbook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "pageMargins")
public class PageMargins {

    @Builder.Default
    @JacksonXmlProperty(isAttribute = true)
    private double left = 0.7;

    @Builder.Default
    @JacksonXmlProperty(isAttribute = true)
    private double right = 0.7;

    @Builder.Default
    @JacksonXmlProperty(isAttribute = true)
    private double top = 0.75;

    @Builder.Default
    @JacksonXmlProperty(isAttribute = true)
    private double bottom = 0.75;

    @Builder.Default
    @JacksonXmlProperty(isAttribute = true)
    private double header = 0.3;

    @Builder.Default
    @JacksonXmlProperty(isAttribute = true)
    private double footer = 0.3;
}
