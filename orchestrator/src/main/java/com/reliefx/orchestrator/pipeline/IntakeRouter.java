package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.bus.TriggerBus;
import com.reliefx.orchestrator.bus.TriggerPublishException;
import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.model.RescueRequest;
import com.reliefx.orchestrator.model.TriggerTopic;
import com.reliefx.orchestrator.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Entry point of the pipeline: validates a submission, writes the Request,
 * and publishes the damage trigger.
 *
 * The write is never rolled back because of a publish failure. A request whose
 * trigger could not be published keeps {@code dispatched_at = null} and is
 * picked up by {@link DispatchReconciler}.
 */
@Service
public class IntakeRouter {

    private static final Logger log = LoggerFactory.getLogger(IntakeRouter.class);

    static final int MAX_NAME_LENGTH      = 100;
    static final int MAX_IMAGERY_LENGTH   = 2048;
    static final int MAX_AOI_LENGTH       = 100_000;

    private final StateStore                 store;
    private final TriggerBus                 bus;
    private final RequestIdGenerator         idGenerator;
    private final PipelineProperties.Intake  config;

    public IntakeRouter(StateStore store, TriggerBus bus,
                        RequestIdGenerator idGenerator, PipelineProperties properties) {
        this.store       = store;
        this.bus         = bus;
        this.idGenerator = idGenerator;
        this.config      = properties.getIntake();
    }

    /**
     * @throws ValidationException if the command is malformed; nothing is written
     */
    public SubmissionReceipt submit(IntakeCommand command) {
        List<String> violations = validate(command);
        if (!violations.isEmpty()) {
            log.info("Rejected rescue request: {}", violations);
            throw new ValidationException(violations);
        }

        String requestId = idGenerator.next();
        RescueRequest request = store.createRequest(new RescueRequest(
                requestId,
                command.regionName().trim(),
                command.eventName().trim(),
                blankToNull(command.areaOfInterest()),
                command.preEventImagery().trim(),
                command.postEventImagery().trim()));
        log.info("Accepted rescue request {} for region '{}' ({})",
                requestId, request.getRegionName(), request.getEventName());

        boolean dispatched = publishWithRetry(requestId);
        return new SubmissionReceipt(requestId, request.getStatus(), dispatched);
    }

    // ------------------------------------------------------------------
    // Internal
    // ------------------------------------------------------------------

    List<String> validate(IntakeCommand command) {
        List<String> violations = new ArrayList<>();
        if (command == null) {
            violations.add("request body is required");
            return violations;
        }
        requireText(violations, "regionName", command.regionName(), MAX_NAME_LENGTH);
        requireText(violations, "eventName", command.eventName(), MAX_NAME_LENGTH);
        requireText(violations, "preEventImagery", command.preEventImagery(), MAX_IMAGERY_LENGTH);
        requireText(violations, "postEventImagery", command.postEventImagery(), MAX_IMAGERY_LENGTH);

        if (command.areaOfInterest() != null && command.areaOfInterest().length() > MAX_AOI_LENGTH) {
            violations.add("areaOfInterest must be at most " + MAX_AOI_LENGTH + " characters");
        }

        List<String> allowed = config.getAllowedRegions();
        if (!allowed.isEmpty() && !isBlank(command.regionName())
                && !allowed.contains(command.regionName().trim())) {
            violations.add("regionName '" + command.regionName().trim() + "' is not an approved region");
        }
        return violations;
    }

    private boolean publishWithRetry(String requestId) {
        int attempts = Math.max(1, config.getPublishAttempts());
        Duration backoff = config.getPublishBackoff();

        for (int attempt = 1; attempt <= attempts; attempt++) {
            UUID messageId;
            try {
                messageId = bus.publish(TriggerTopic.DAMAGE_ANALYSIS, requestId);
            } catch (TriggerPublishException e) {
                log.warn("Publish of damage trigger for {} failed (attempt {}/{}): {}",
                        requestId, attempt, attempts, e.getMessage());
                if (attempt < attempts && !sleep(backoff.multipliedBy(1L << (attempt - 1)))) {
                    break;
                }
                continue;
            }
            try {
                store.markRequestDispatched(requestId);
            } catch (RuntimeException e) {
                // The trigger is enqueued; the reconciler may publish a harmless duplicate.
                log.warn("Trigger {} enqueued for {} but dispatch could not be recorded: {}",
                        messageId, requestId, e.getMessage());
            }
            log.info("Damage trigger {} published for request {}", messageId, requestId);
            return true;
        }

        log.error("Request {} stored but its damage trigger could not be published after {} attempt(s); "
                + "left for the dispatch reconciler", requestId, attempts);
        return false;
    }

    private static boolean sleep(Duration d) {
        if (d.isZero() || d.isNegative()) return true;
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void requireText(List<String> violations, String field, String value, int max) {
        if (isBlank(value)) {
            violations.add(field + " is required");
        } else if (value.trim().length() > max) {
            violations.add(field + " must be at most " + max + " characters");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s;
    }
}
