package com.optionseller.controller;

import com.optionseller.dto.ApiResponse;
import com.optionseller.dto.ScheduleSellRequest;
import com.optionseller.dto.ScheduledSellResponse;
import com.optionseller.model.ExecutionEvent;
import com.optionseller.model.MarketSnapshot;
import com.optionseller.model.ScheduledSellJob;
import com.optionseller.service.market.MarketSnapshotService;
import com.optionseller.service.strategy.ExecutionEventRecorder;
import com.optionseller.service.strategy.SellOrderScheduler;
import com.optionseller.util.ApiConstants;
import com.optionseller.util.FireTimeParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/sell-orders")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Scheduled Sells", description = "Delayed short call + short put at a target premium")
public class ScheduledSellController {

    private final SellOrderScheduler sellOrderScheduler;
    private final MarketSnapshotService marketSnapshotService;
    private final ExecutionEventRecorder eventRecorder;
    private final Clock marketClock;

    @PostMapping("/schedule")
    @Operation(summary = "Add a sell order to the queue",
               description = "Arms a job that, at the given time, sells the OTM call and put trading closest to the target price")
    public ResponseEntity<ApiResponse<ScheduledSellResponse>> schedule(@Valid @RequestBody ScheduleSellRequest request) {
        log.info(ApiConstants.LOG_SCHEDULE_REQUEST, request.getTargetPrice(), request.getTime(), request.getFireAt());
        Instant fireAt = request.getFireAt() != null
                ? request.getFireAt()
                : FireTimeParser.todayAt(request.getTime(), marketClock);

        ScheduledSellJob job = sellOrderScheduler.requestSchedule(request.getTargetPrice(), fireAt);
        log.info(ApiConstants.LOG_SCHEDULE_RESPONSE, job.getJobId(), job.getFireAt());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(ApiConstants.MSG_SELL_SCHEDULED, ScheduledSellResponse.from(job)));
    }

    @GetMapping("/jobs")
    @Operation(summary = "List scheduled sells", description = "Armed, running and finished jobs of this process")
    public ResponseEntity<ApiResponse<List<ScheduledSellResponse>>> getJobs() {
        log.info(ApiConstants.LOG_GET_JOBS_REQUEST);
        List<ScheduledSellResponse> jobs = sellOrderScheduler.getJobs().stream()
                .map(ScheduledSellResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(jobs));
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get a scheduled sell")
    public ResponseEntity<ApiResponse<ScheduledSellResponse>> getJob(@PathVariable String jobId) {
        return sellOrderScheduler.getJob(jobId)
                .map(job -> ResponseEntity.ok(ApiResponse.success(ScheduledSellResponse.from(job))))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error(ApiConstants.MSG_JOB_NOT_FOUND + jobId)));
    }

    @GetMapping("/events")
    @Operation(summary = "Recent execution events", description = "Optionally filtered to a single job")
    public ResponseEntity<ApiResponse<List<ExecutionEvent>>> getEvents(@RequestParam(required = false) String jobId) {
        List<ExecutionEvent> events = jobId == null
                ? eventRecorder.getRecentEvents()
                : eventRecorder.getRecentEvents(jobId);
        return ResponseEntity.ok(ApiResponse.success(events));
    }

    @GetMapping("/snapshot")
    @Operation(summary = "Current market snapshot", description = "ATM strike and OTM candidates from the last refresh")
    public ResponseEntity<ApiResponse<MarketSnapshot>> getSnapshot() {
        return marketSnapshotService.current()
                .map(snapshot -> ResponseEntity.ok(ApiResponse.success(snapshot)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error(ApiConstants.MSG_NO_SNAPSHOT)));
    }

    @PostMapping("/snapshot/refresh")
    @Operation(summary = "Refresh market snapshot", description = "Re-reads the index LTP and rebuilds ATM and candidates")
    public ResponseEntity<ApiResponse<MarketSnapshot>> refreshSnapshot() {
        log.info(ApiConstants.LOG_REFRESH_SNAPSHOT_REQUEST);
        MarketSnapshot snapshot = marketSnapshotService.refreshCurrent();
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_SNAPSHOT_REFRESHED, snapshot));
    }
}
