package com.riftinsight.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riftinsight.domain.model.AnalyzeRequest;
import com.riftinsight.domain.model.QueueStats;
import com.riftinsight.domain.model.RiotId;
import com.riftinsight.domain.service.AdmissionQueue;
import com.riftinsight.domain.service.AnalysisStreamService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for player analysis.
 *
 * Endpoints:
 * - POST /api/analyze - Stream a player analysis as NDJSON
 * - GET /api/queue - Current analysis queue stats
 * - GET /api/health - Liveness and version
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalysisController {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson;charset=utf-8");
    static final String VERSION = "0.1.0";

    private final AnalysisStreamService analysisStreamService;
    private final AdmissionQueue admissionQueue;
    private final ObjectMapper objectMapper;

    /**
     * Analyze a player.
     *
     * POST /api/analyze
     *
     * Request body:
     * {
     *   "riotId": "Name#TAG",
     *   "region": "euw1"
     * }
     *
     * Response: one JSON object per line, progress events followed by exactly
     * one result or error event. A Riot ID without '#' is rejected with 400
     * before any analysis slot is requested.
     */
    @PostMapping("/analyze")
    public ResponseEntity<StreamingResponseBody> analyze(@Valid @RequestBody AnalyzeRequest request) {
        RiotId riotId = RiotId.parse(request.getRiotId());
        String region = request.getRegion();

        log.info("Analyze request: riotId={}, region={}", riotId, region);

        StreamingResponseBody body = out ->
                analysisStreamService.analyze(riotId, region, new NdjsonProgressSink(out, objectMapper));

        return ResponseEntity.ok()
                .contentType(NDJSON)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-transform")
                .header("X-Accel-Buffering", "no")
                .header(HttpHeaders.CONNECTION, "keep-alive")
                .body(body);
    }

    /**
     * GET /api/queue
     */
    @GetMapping("/queue")
    public ResponseEntity<QueueStats> queue() {
        return ResponseEntity.ok(admissionQueue.stats());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("version", VERSION);
        return ResponseEntity.ok(body);
    }
}
