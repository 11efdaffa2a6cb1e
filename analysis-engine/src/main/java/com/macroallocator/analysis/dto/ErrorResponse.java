package com.macroallocator.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    @JsonProperty("status") String status,
    @JsonProperty("message") String message
) {
    public static ErrorResponse of(String message) {
        return new ErrorResponse("error", message);
    }
}
