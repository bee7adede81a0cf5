package com.example.sheetstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JacksonXmlRootElement(localName = "pageSetup")
public class PageSetup {

    /**
     * Paper size code (1 = Letter, 9 = A4)
     */
    @JacksonXmlProperty(isAttribute = true)
    private Integer paperSize;

    @JacksonXmlProperty(isAttribute = true)
    private Integer scale;

    @JacksonXmlProperty(isAttribute = true)
    private Integer fitToWidth;

    @JacksonXmlProperty(isAttribute = true)
    private Integer fitToHeight;

    /**
     * "default", "portrait" or "landscape"
     */
    @JacksonXmlProperty(isAttribute = true)
    private String orientation;
}
