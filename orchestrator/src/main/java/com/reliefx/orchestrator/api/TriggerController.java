package com.reliefx.orchestrator.api;

import com.reliefx.orchestrator.api.dto.TriggerResponse;
import com.reliefx.orchestrator.bus.TriggerLedger;
import com.reliefx.orchestrator.model.Trigger;
import com.reliefx.orchestrator.model.TriggerState;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator view of the Trigger Bus.
 *
 * GET /triggers?state=DEAD        — dead letters (newest first, at most 100)
 * GET /triggers?requestId={id}    — every trigger ever published for one request
 */
@RestController
@RequestMapping("/triggers")
public class TriggerController {

    private final TriggerLedger ledger;

    public TriggerController(TriggerLedger ledger) {
        this.ledger = ledger;
    }

    @GetMapping
    public List<TriggerResponse> list(@RequestParam(required = false) TriggerState state,
                                      @RequestParam(required = false) String requestId) {
        List<Trigger> triggers = requestId != null
                ? ledger.findByRequest(requestId)
                : ledger.findByState(state != null ? state : TriggerState.DEAD);
        return triggers.stream()
                .filter(t -> state == null || t.getState() == state)
                .map(TriggerResponse::from)
                .toList();
    }
}
