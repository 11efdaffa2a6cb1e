package com.macroallocator.analysis.controller;

import com.macroallocator.analysis.client.EconomicDataWebClient;
import com.macroallocator.analysis.client.NewsWebClient;
import com.macroallocator.analysis.dto.AnalyzeRequest;
import com.macroallocator.analysis.dto.AnalyzeResponse;
import com.macroallocator.analysis.dto.HealthResponse;
import com.macroallocator.analysis.service.AnalysisService;
import com.macroallocator.analysis.universe.CandidateUniverse;
import com.macroallocator.common.universe.CatalogSnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
public class AnalysisController {

    private final AnalysisService analysisService;
    private final CandidateUniverse universe;
    private final NewsWebClient newsClient;
    private final EconomicDataWebClient economicClient;

    public AnalysisController(AnalysisService analysisService,
                              CandidateUniverse universe,
                              NewsWebClient newsClient,
                              EconomicDataWebClient economicClient) {
        this.analysisService = analysisService;
        this.universe        = universe;
        this.newsClient      = newsClient;
        this.economicClient  = economicClient;
    }

    @PostMapping("/analyze")
    public Mono<ResponseEntity<AnalyzeResponse>> analyze(@RequestBody AnalyzeRequest request) {
        return analysisService.analyze(request.text())
            .map(AnalyzeResponse::from)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        CatalogSnapshot snapshot = universe.currentSnapshot().orElse(null);
        return ResponseEntity.ok(new HealthResponse(
            "ok",
            snapshot != null ? snapshot.size() : 0,
            snapshot != null ? snapshot.syntheticCount() : 0,
            snapshot != null ? snapshot.loadedAt() : null,
            newsClient.isConfigured(),
            economicClient.isConfigured()));
    }
}
