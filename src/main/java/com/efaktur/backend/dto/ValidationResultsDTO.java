package com.efaktur.backend.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResultsDTO {

    private List<DeviationDTO> deviations;

    @JsonProperty("validated_data")
    private Map<String, String> validatedData;

    @JsonProperty("extracted_data")
    private Map<String, String> extractedData;

    @JsonProperty("qr_url")
    private String qrUrl;

    @JsonProperty("raw_ocr_text")
    private String rawOcrText;
}
