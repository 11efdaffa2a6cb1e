package com.macroallocator.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnalyzeRequest(@JsonProperty("text") String text) {}
