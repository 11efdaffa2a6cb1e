package com.macroallocator.analysis.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One entry of Finnhub's {@code /api/v1/news} array. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinnhubNewsItem {
    private long id;
    private String category;
    private long datetime;
    private String headline;
    private String source;
    private String summary;
    private String url;
}
