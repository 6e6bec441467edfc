package com.inventoryforecast.controller;

import com.inventoryforecast.config.RequestIdFilter;
import com.inventoryforecast.dto.AlertRequest;
import com.inventoryforecast.dto.CleanedTableSummary;
import com.inventoryforecast.dto.FeatureTableSummary;
import com.inventoryforecast.dto.ForecastRequest;
import com.inventoryforecast.dto.InsightRequest;
import com.inventoryforecast.dto.PipelineStatusResponse;
import com.inventoryforecast.dto.RecordUploadRequest;
import com.inventoryforecast.dto.TrainRequest;
import com.inventoryforecast.dto.TrainingResponse;
import com.inventoryforecast.dto.UploadResponse;
import com.inventoryforecast.dto.WeatherUploadRequest;
import com.inventoryforecast.model.AlertBatch;
import com.inventoryforecast.model.AlertThresholds;
import com.inventoryforecast.model.EvaluationReport;
import com.inventoryforecast.model.FeatureOptions;
import com.inventoryforecast.model.Forecast;
import com.inventoryforecast.model.InsightSet;
import com.inventoryforecast.model.PreprocessingOptions;
import com.inventoryforecast.service.ForecastPipelineService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/sessions/{sessionId}")
@RequiredArgsConstructor
public class PipelineController {

    private static final String SESSION_PATTERN = "^[a-zA-Z0-9._-]{1,64}$";

    private final ForecastPipelineService pipelineService;

    @PostMapping("/records")
    public ResponseEntity<UploadResponse> uploadRecords(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId,
            @Valid @RequestBody RecordUploadRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /records | session={} | count={} | requestId={}",
                 sessionId, request.getRecords().size(), requestId);
        int stored = pipelineService.uploadRecords(sessionId, request.getRecords(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED).body(UploadResponse.builder()
            .sessionId(sessionId).count(stored).uploadedAt(Instant.now()).build());
    }

    @PostMapping("/weather")
    public ResponseEntity<UploadResponse> uploadWeather(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId,
            @Valid @RequestBody WeatherUploadRequest request, HttpServletRequest httpRequest) {
        log.info("POST /weather | session={} | count={} | requestId={}",
                 sessionId, request.getObservations().size(), resolveRequestId(httpRequest));
        int stored = pipelineService.uploadWeather(sessionId, request.getObservations());
        return ResponseEntity.status(HttpStatus.CREATED).body(UploadResponse.builder()
            .sessionId(sessionId).count(stored).uploadedAt(Instant.now()).build());
    }

    @PostMapping("/preprocess")
    public ResponseEntity<CleanedTableSummary> preprocess(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId,
            @RequestBody(required = false) PreprocessingOptions options, HttpServletRequest httpRequest) {
        log.info("POST /preprocess | session={} | options={} | requestId={}",
                 sessionId, options, resolveRequestId(httpRequest));
        return ResponseEntity.ok(CleanedTableSummary.from(pipelineService.preprocess(sessionId, options)));
    }

    @PostMapping("/features")
    public ResponseEntity<FeatureTableSummary> features(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId,
            @RequestBody(required = false) FeatureOptions options, HttpServletRequest httpRequest) {
        log.info("POST /features | session={} | options={} | requestId={}",
                 sessionId, options, resolveRequestId(httpRequest));
        return ResponseEntity.ok(FeatureTableSummary.from(pipelineService.engineerFeatures(sessionId, options)));
    }

    @PostMapping("/train")
    public ResponseEntity<TrainingResponse> train(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId,
            @RequestBody TrainRequest request, HttpServletRequest httpRequest) {
        log.info("POST /train | session={} | kinds={} | testFraction={} | requestId={}",
                 sessionId, request.getModelKinds(), request.getTestFraction(), resolveRequestId(httpRequest));
        return ResponseEntity.ok(TrainingResponse.from(
            pipelineService.train(sessionId, request.getModelKinds(), request.getTestFraction())));
    }

    @PostMapping("/forecast")
    public ResponseEntity<Forecast> forecast(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId,
            @Valid @RequestBody ForecastRequest request, HttpServletRequest httpRequest) {
        log.info("POST /forecast | session={} | kind={} | horizon={} | requestId={}",
                 sessionId, request.getModelKind(), request.getHorizonDays(), resolveRequestId(httpRequest));
        return ResponseEntity.ok(pipelineService.forecast(sessionId, request.getModelKind(), request.getHorizonDays()));
    }

    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationReport> evaluate(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId, HttpServletRequest httpRequest) {
        log.info("POST /evaluate | session={} | requestId={}", sessionId, resolveRequestId(httpRequest));
        return ResponseEntity.ok(pipelineService.evaluate(sessionId));
    }

    @PostMapping("/insights")
    public ResponseEntity<InsightSet> insights(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId,
            @RequestBody(required = false) InsightRequest request, HttpServletRequest httpRequest) {
        InsightRequest params = request != null ? request : InsightRequest.builder().build();
        log.info("POST /insights | session={} | leadTime={} | serviceLevel={} | requestId={}",
                 sessionId, params.getLeadTimeDays(), params.getServiceLevel(), resolveRequestId(httpRequest));
        return ResponseEntity.ok(pipelineService.insights(sessionId, params.toParameters()));
    }

    @PostMapping("/alerts")
    public ResponseEntity<AlertBatch> alerts(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId,
            @Valid @RequestBody(required = false) AlertRequest request, HttpServletRequest httpRequest) {
        log.info("POST /alerts | session={} | requestId={}", sessionId, resolveRequestId(httpRequest));
        return ResponseEntity.ok(pipelineService.alerts(sessionId, toThresholds(request)));
    }

    @GetMapping("/alerts/history")
    public ResponseEntity<List<AlertBatch>> alertHistory(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId,
            @RequestParam(required = false) Integer days) {
        return ResponseEntity.ok(pipelineService.alertHistory(sessionId, days));
    }

    @GetMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId, HttpServletRequest httpRequest) {
        log.info("GET /report | session={} | requestId={}", sessionId, resolveRequestId(httpRequest));
        return ResponseEntity.ok()
            .contentType(MediaType.TEXT_PLAIN)
            .body(pipelineService.report(sessionId));
    }

    @GetMapping("/status")
    public ResponseEntity<PipelineStatusResponse> status(
            @PathVariable @Pattern(regexp = SESSION_PATTERN) String sessionId) {
        return ResponseEntity.ok(PipelineStatusResponse.builder()
            .sessionId(sessionId)
            .stages(pipelineService.status(sessionId))
            .build());
    }

    private AlertThresholds toThresholds(AlertRequest request) {
        AlertThresholds defaults = pipelineService.defaultAlertThresholds();
        if (request == null) {
            return defaults;
        }
        return new AlertThresholds(
            request.getCriticalDemand() != null ? request.getCriticalDemand() : defaults.criticalDemand(),
            request.getLowDemand() != null ? request.getLowDemand() : defaults.lowDemand(),
            request.getSpikeDemand() != null ? request.getSpikeDemand() : defaults.spikeDemand());
    }

    private String resolveRequestId(HttpServletRequest request) {
        Object attribute = request.getAttribute(RequestIdFilter.MDC_KEY);
        if (attribute != null) {
            return attribute.toString();
        }
        String id = request.getHeader(RequestIdFilter.HEADER);
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
