package com.earlywarning.analyzer.api;

import com.earlywarning.analyzer.engine.ThreatVerdict;
import com.earlywarning.analyzer.engine.UrlThreatAnalyzer;
import com.earlywarning.analyzer.history.ScanRecord;
import com.earlywarning.analyzer.history.ScanRecordStore;
import com.earlywarning.analyzer.history.ScanSummary;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * REST API in front of the analysis engine.
 *
 * <p>
 * The engine only produces verdicts; this controller stores each verdict as
 * a {@link ScanRecord} and serves the history and aggregate views used by
 * dashboards.
 * </p>
 *
 * @author Naveed Gung
 */
@RestController
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final UrlThreatAnalyzer analyzer;
    private final ScanRecordStore scanRecordStore;
    private final Clock clock;

    public AnalysisController(UrlThreatAnalyzer analyzer, ScanRecordStore scanRecordStore, Clock clock) {
        this.analyzer = analyzer;
        this.scanRecordStore = scanRecordStore;
        this.clock = clock;
    }

    /**
     * Analyse a URL and record the verdict.
     * POST /analyze-url
     */
    @PostMapping(value = "/analyze-url", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ThreatVerdict> analyzeUrl(@Valid @RequestBody AnalyzeUrlRequest request) {
        return analyzer.analyzeAsync(request.url())
                .doOnNext(verdict -> {
                    ScanRecord record = scanRecordStore.save(
                            ScanRecord.of(verdict, request.userId(), clock.instant()));
                    log.debug("Stored scan {} for {}", record.id(), verdict.url());
                });
    }

    /**
     * Most recent scans, newest first.
     * GET /scan-history?limit=50
     */
    @GetMapping(value = "/scan-history", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<ScanRecord>> scanHistory(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return Mono.fromSupplier(() -> scanRecordStore.recent(limit));
    }

    /**
     * Remove a stored scan.
     * DELETE /scan-history/{scanId}
     */
    @DeleteMapping(value = "/scan-history/{scanId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, String>> deleteScan(@PathVariable String scanId) {
        return Mono.fromSupplier(() -> {
            if (!scanRecordStore.delete(scanId)) {
                throw new ScanNotFoundException(scanId);
            }
            log.info("Deleted scan {}", scanId);
            return Map.of("status", "deleted", "scanId", scanId);
        });
    }

    /**
     * Verdict counts for dashboards.
     * GET /analytics
     */
    @GetMapping(value = "/analytics", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ScanSummary> analytics() {
        return Mono.fromSupplier(scanRecordStore::summary);
    }
}
