package com.reliefx.orchestrator.api;

import com.reliefx.orchestrator.api.dto.*;
import com.reliefx.orchestrator.model.RecordType;
import com.reliefx.orchestrator.model.RequestStatus;
import com.reliefx.orchestrator.model.RescueRequest;
import com.reliefx.orchestrator.pipeline.IntakeRouter;
import com.reliefx.orchestrator.pipeline.ReprocessAction;
import com.reliefx.orchestrator.pipeline.ReprocessService;
import com.reliefx.orchestrator.pipeline.SubmissionReceipt;
import com.reliefx.orchestrator.pipeline.ValidationException;
import com.reliefx.orchestrator.store.RecordChange;
import com.reliefx.orchestrator.store.StateStore;
import com.reliefx.orchestrator.store.Subscription;
import com.reliefx.orchestrator.store.UnknownRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * REST API for rescue requests.
 *
 * POST /requests                  — submit a request (202, processing is asynchronous)
 * GET  /requests                  — newest requests, optionally filtered by ?status=
 * GET  /requests/{id}             — request plus damage report and logistics plan
 * GET  /requests/{id}/events      — Server-Sent Events for every committed change
 * POST /requests/{id}/reprocess   — operator: rerun the first failed stage
 */
@RestController
@RequestMapping("/requests")
public class RescueRequestController {

    private static final Logger log = LoggerFactory.getLogger(RescueRequestController.class);

    // Observers reconnect after this; the pipeline itself can take many minutes.
    static final long EVENT_STREAM_TIMEOUT_MS = 30 * 60 * 1000L;

    private final IntakeRouter     router;
    private final StateStore       store;
    private final ReprocessService reprocessService;

    public RescueRequestController(IntakeRouter router, StateStore store, ReprocessService reprocessService) {
        this.router           = router;
        this.store            = store;
        this.reprocessService = reprocessService;
    }

    /**
     * Submit a rescue request. Returns as soon as the request is stored and its
     * damage trigger is enqueued; poll GET /requests/{id} for progress.
     *
     * Example:
     *   curl -X POST http://localhost:8080/requests \
     *     -H "Content-Type: application/json" \
     *     -d '{"regionName":"Valencia","eventName":"DANA floods 2024",
     *          "preEventImagery":"s3://imagery/valencia/pre.tif",
     *          "postEventImagery":"s3://imagery/valencia/post.tif"}'
     */
    @PostMapping
    public ResponseEntity<SubmissionResponse> submit(@RequestBody SubmitRescueRequest req) {
        SubmissionReceipt receipt = router.submit(req.toCommand());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmissionResponse.from(receipt));
    }

    @GetMapping
    public List<RequestSummary> list(@RequestParam(required = false) RequestStatus status) {
        return store.listRequests(status).stream()
                .map(RequestSummary::from)
                .toList();
    }

    /** Returns 404 if the request id is not found. */
    @GetMapping("/{id}")
    public PipelineStatusResponse get(@PathVariable String id) {
        RescueRequest request = requireRequest(id);
        return PipelineStatusResponse.from(
                request,
                store.findDamageReport(id).orElse(null),
                store.findLogisticsPlan(id).orElse(null));
    }

    /**
     * Stream changes to this request, its damage report and its logistics plan.
     *
     * The first event is the request's current status; subsequent events are
     * emitted after each committed write. The stream ends when the request
     * reaches COMPLETED, or on timeout.
     *
     * Store listeners run on the thread that committed the write (usually a
     * stage worker), so each stream sends from its own single thread, in order.
     */
    @GetMapping(path = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String id) {
        RescueRequest request = requireRequest(id);
        SseEmitter emitter = new SseEmitter(EVENT_STREAM_TIMEOUT_MS);
        ExecutorService sender = newSender(id);

        // Queued before subscribing, so the snapshot always goes out first.
        RecordChange current = new RecordChange(RecordType.REQUEST, id, request.getStatus().name(), request.getUpdatedAt());
        sender.execute(() -> send(emitter, current));

        Consumer<RecordChange> forward = change -> {
            if (!change.requestId().equals(id)) return;
            try {
                sender.execute(() -> {
                    send(emitter, change);
                    if (change.type() == RecordType.REQUEST
                            && RequestStatus.COMPLETED.name().equals(change.status())) {
                        emitter.complete();
                    }
                });
            } catch (RejectedExecutionException e) {
                log.debug("Event stream for {} already closed; dropping {}", id, change.type());
            }
        };

        List<Subscription> subscriptions = new ArrayList<>();
        for (RecordType type : RecordType.values()) {
            subscriptions.add(store.subscribe(type, forward));
        }
        Runnable unsubscribe = () -> {
            subscriptions.forEach(Subscription::close);
            sender.shutdown();
        };
        emitter.onCompletion(unsubscribe);
        emitter.onTimeout(unsubscribe);
        emitter.onError(e -> unsubscribe.run());
        return emitter;
    }

    /**
     * Operator reprocess.
     *
     * HTTP 202 — a trigger was re-published
     * HTTP 409 — nothing to reprocess (stage in progress or already complete)
     * HTTP 404 — request id not found
     */
    @PostMapping("/{id}/reprocess")
    public ResponseEntity<ReprocessResponse> reprocess(@PathVariable String id) {
        ReprocessAction action = reprocessService.reprocess(id);
        HttpStatus status = action == ReprocessAction.NOTHING_TO_DO ? HttpStatus.CONFLICT : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(new ReprocessResponse(id, action));
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> onValidation(ValidationException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("invalid rescue request", e.getViolations()));
    }

    @ExceptionHandler(UnknownRequestException.class)
    public ResponseEntity<ErrorResponse> onUnknownRequest(UnknownRequestException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(e.getMessage(), List.of()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RescueRequest requireRequest(String id) {
        return store.findRequest(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Request not found: " + id));
    }

    private static ExecutorService newSender(String requestId) {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "request-events-" + requestId);
            t.setDaemon(true);
            return t;
        });
    }

    private static void send(SseEmitter emitter, RecordChange change) {
        try {
            emitter.send(SseEmitter.event().name(change.type().name()).data(change));
        } catch (IOException | IllegalStateException e) {
            // Client went away or the emitter already completed.
            log.debug("Dropping event for {}: {}", change.requestId(), e.getMessage());
            emitter.completeWithError(e);
        }
    }
}
