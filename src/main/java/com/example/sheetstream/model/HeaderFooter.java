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
@JacksonXmlRootElement(localName = "headerFooter")
public class HeaderFooter {

    @JacksonXmlProperty(isAttribute = true)
    private Boolean differentFirst;

    @JacksonXmlProperty(localName = "oddHeader")
    private String oddHeader;

    @JacksonXmlProperty(localName = "oddFooter")
    private String oddFooter;
}
