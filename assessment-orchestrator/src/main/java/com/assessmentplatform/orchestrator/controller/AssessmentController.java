package com.assessmentplatform.orchestrator.controller;

import com.assessmentplatform.common.model.AssessmentSnapshot;
import com.assessmentplatform.common.model.Decision;
import com.assessmentplatform.common.model.MeasurementResult;
import com.assessmentplatform.orchestrator.controller.dto.CaptureRequest;
import com.assessmentplatform.orchestrator.session.AssessmentWorkflowService;
import com.assessmentplatform.orchestrator.session.SessionBusyException;
import com.assessmentplatform.orchestrator.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the orchestrator. Every mutating call answers with the session snapshot
 * taken after the operation; 404 for unknown sessions, 409 while another navigation request
 * for the same session is running.
 */
@RestController
@RequestMapping("/api/v1/assessments")
public class AssessmentController {

    private static final Logger log = LoggerFactory.getLogger(AssessmentController.class);

    private final AssessmentWorkflowService workflowService;

    public AssessmentController(AssessmentWorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @PostMapping
    public Mono<ResponseEntity<AssessmentSnapshot>> create() {
        return workflowService.create()
            .map(snapshot -> ResponseEntity.status(HttpStatus.CREATED).body(snapshot));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<AssessmentSnapshot>> get(@PathVariable String id) {
        return respond(workflowService.snapshot(id));
    }

    @PostMapping("/{id}/start")
    public Mono<ResponseEntity<AssessmentSnapshot>> start(@PathVariable String id) {
        return respond(workflowService.start(id));
    }

    @PostMapping("/{id}/proceed")
    public Mono<ResponseEntity<AssessmentSnapshot>> proceed(@PathVariable String id) {
        return respond(workflowService.proceed(id));
    }

    @PostMapping("/{id}/back")
    public Mono<ResponseEntity<AssessmentSnapshot>> back(@PathVariable String id) {
        return respond(workflowService.goBack(id));
    }

    @PostMapping("/{id}/answers")
    public Mono<ResponseEntity<AssessmentSnapshot>> answers(@PathVariable String id,
                                                            @RequestBody Map<String, Object> answers) {
        return respond(workflowService.submitAnswers(id, answers));
    }

    @PostMapping("/{id}/measurements")
    public Mono<ResponseEntity<AssessmentSnapshot>> measurement(@PathVariable String id,
                                                                @RequestBody MeasurementResult result) {
        return respond(workflowService.applyMeasurement(id, result));
    }

    @PostMapping("/{id}/capture")
    public Mono<ResponseEntity<AssessmentSnapshot>> beginCapture(@PathVariable String id,
                                                                 @RequestBody CaptureRequest request) {
        return respond(workflowService.beginCapture(id, request.type()));
    }

    @DeleteMapping("/{id}/capture")
    public Mono<ResponseEntity<AssessmentSnapshot>> endCapture(@PathVariable String id) {
        return respond(workflowService.endCapture(id));
    }

    @PostMapping("/{id}/complete")
    public Mono<ResponseEntity<AssessmentSnapshot>> complete(@PathVariable String id) {
        return respond(workflowService.complete(id));
    }

    @GetMapping("/{id}/decisions")
    public Mono<ResponseEntity<List<Decision>>> decisions(@PathVariable String id) {
        return respond(workflowService.decisions(id));
    }

    /** Server-Sent Events: the latest snapshot on connect, then one per transition. */
    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<AssessmentSnapshot>> stream(@PathVariable String id) {
        log.info("SSE stream client connected. sessionId={}", id);
        return workflowService.stream(id)
            .onErrorMap(SessionNotFoundException.class,
                e -> new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage()))
            .map(snapshot -> ServerSentEvent.<AssessmentSnapshot>builder()
                .event("snapshot")
                .data(snapshot)
                .build());
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> discard(@PathVariable String id) {
        return workflowService.discard(id)
            .then(Mono.just(ResponseEntity.noContent().<Void>build()))
            .onErrorResume(SessionNotFoundException.class,
                e -> Mono.just(ResponseEntity.notFound().<Void>build()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private <T> Mono<ResponseEntity<T>> respond(Mono<T> result) {
        return result
            .map(ResponseEntity::ok)
            .onErrorResume(SessionNotFoundException.class,
                e -> Mono.just(ResponseEntity.notFound().<T>build()))
            .onErrorResume(SessionBusyException.class, e -> {
                log.info("Request rejected, session busy. sessionId={}", e.getSessionId());
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).<T>build());
            })
            .onErrorResume(IllegalArgumentException.class,
                e -> Mono.just(ResponseEntity.badRequest().<T>build()));
    }
}
