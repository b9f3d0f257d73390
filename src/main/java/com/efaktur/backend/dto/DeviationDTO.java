package com.efaktur.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviationDTO {

    private String field;

    @JsonProperty("pdf_value")
    private String pdfValue;

    @JsonProperty("djp_api_value")
    private String djpApiValue;

    @JsonProperty("deviation_type")
    private String deviationType;
}
