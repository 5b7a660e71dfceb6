package com.imaginarium.orchestrator.api;

import com.imaginarium.orchestrator.api.dto.CancelRunRequest;
import com.imaginarium.orchestrator.api.dto.LogEntryResponse;
import com.imaginarium.orchestrator.api.dto.RunResponse;
import com.imaginarium.orchestrator.api.dto.SubmitRunRequest;
import com.imaginarium.orchestrator.api.dto.TaskResponse;
import com.imaginarium.orchestrator.api.dto.ValidationErrorResponse;
import com.imaginarium.orchestrator.event.SseEventSink;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.service.PipelineValidationException;
import com.imaginarium.orchestrator.service.RunNotRetryableException;
import com.imaginarium.orchestrator.service.RunService;
import com.imaginarium.orchestrator.store.StoreUnavailableException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for run lifecycle.
 *
 * POST /runs              : compile and enqueue a pipeline
 * GET  /runs/{id}         : current state, progress and task counts
 * GET  /runs/{id}/tasks   : all tasks with their outputs and errors
 * GET  /runs/{id}/logs    : execution log, paged by sequence
 * GET  /runs/{id}/events  : live event stream (server-sent events)
 * POST /runs/{id}/cancel  : cancel a run that has not finished
 * POST /runs/{id}/retry   : re-submit a FAILED or CANCELLED run as a new run
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService   runService;
    private final SseEventSink sseSink;

    public RunController(RunService runService, SseEventSink sseSink) {
        this.runService = runService;
        this.sseSink    = sseSink;
    }

    /**
     * Submit a pipeline for execution.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"pipelineId":"p1","userId":"u1","priority":5,
     *          "definition":{"nodes":[{"id":"in","type":"text-input","config":{"text":"hi"}}],
     *                        "connections":[]}}'
     *
     * HTTP 201: run created (QUEUED)
     * HTTP 400: the pipeline does not compile; nothing was created
     */
    @PostMapping
    public ResponseEntity<RunResponse> submit(@Valid @RequestBody SubmitRunRequest req) {
        Run run = runService.submit(req.pipelineId(), req.userId(), req.priority(),
                req.maxRetries(), req.timeout(), req.definition());
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    /**
     * Poll the current state of a run.
     * Returns 404 if the run ID is not found.
     */
    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        Run run = runService.findById(id).orElseThrow(() -> notFound(id));
        return RunResponse.from(run, runService.taskCounts(id));
    }

    @GetMapping("/{id}/tasks")
    public List<TaskResponse> getTasks(@PathVariable UUID id) {
        return runService.getTasks(id).stream()
                .map(TaskResponse::from)
                .toList();
    }

    /**
     * Read the execution log. Pass the last sequence seen as afterSequence
     * to continue where the previous page ended.
     */
    @GetMapping("/{id}/logs")
    public List<LogEntryResponse> getLogs(@PathVariable UUID id,
                                          @RequestParam(defaultValue = "0") long afterSequence,
                                          @RequestParam(defaultValue = "100") int limit) {
        return runService.getLogs(id, afterSequence, limit).stream()
                .map(LogEntryResponse::from)
                .toList();
    }

    /**
     * Subscribe to the run's events. Each SSE message carries the event
     * sequence as its id; the stream ends with the run's terminal event.
     */
    @GetMapping(path = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable UUID id) {
        Run run = runService.findById(id).orElseThrow(() -> notFound(id));
        SseEmitter emitter = sseSink.subscribe(id);
        if (run.getStatus().isTerminal()) {
            emitter.complete();
        }
        return emitter;
    }

    /**
     * HTTP 200: cancel accepted, body is the CANCELLED run
     * HTTP 409: the run had already finished
     * HTTP 404: run ID not found
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<RunResponse> cancel(@PathVariable UUID id,
                                              @RequestBody(required = false) CancelRunRequest req) {
        boolean cancelled = runService.cancel(id, req == null ? null : req.reason());
        Run run = runService.findById(id).orElseThrow(() -> notFound(id));
        return ResponseEntity.status(cancelled ? HttpStatus.OK : HttpStatus.CONFLICT)
                .body(RunResponse.from(run));
    }

    /**
     * HTTP 201: new run created, linked by parentRunId
     * HTTP 409: the run is not FAILED or CANCELLED
     */
    @PostMapping("/{id}/retry")
    public ResponseEntity<RunResponse> retry(@PathVariable UUID id) {
        Run run = runService.retry(id);
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @ExceptionHandler(PipelineValidationException.class)
    public ResponseEntity<ValidationErrorResponse> invalidPipeline(PipelineValidationException e) {
        return ResponseEntity.badRequest().body(ValidationErrorResponse.from(e.getError()));
    }

    @ExceptionHandler(RunNotRetryableException.class)
    public ResponseEntity<Map<String, String>> notRetryable(RunNotRetryableException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(StoreUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id);
    }
}
