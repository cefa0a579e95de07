package com.pokerplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pokerplatform.common.health.PanicStopReason;
import com.pokerplatform.common.health.PanicStopType;
import com.pokerplatform.common.health.SafeModeState;
import com.pokerplatform.orchestrator.health.PanicStopController;
import com.pokerplatform.orchestrator.health.SafeModeController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator controls for safe mode and panic stop.
 *
 * <p>Operator safe-mode entries are manual, so only {@code /safe-mode/exit} clears them.
 * A request that would not change anything answers 409 with the current state.
 */
@RestController
@RequestMapping("/api/v1/safety")
public class SafetyController {

    private static final Logger log = LoggerFactory.getLogger(SafetyController.class);

    private final SafeModeController safeMode;
    private final PanicStopController panicStop;

    public SafetyController(SafeModeController safeMode, PanicStopController panicStop) {
        this.safeMode  = safeMode;
        this.panicStop = panicStop;
    }

    @GetMapping
    public ResponseEntity<SafetyState> state() {
        return ResponseEntity.ok(current());
    }

    @PostMapping("/safe-mode/enter")
    public ResponseEntity<SafetyState> enterSafeMode(@RequestBody(required = false) OperatorRequest request) {
        if (safeMode.isActive()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(current());
        }
        String reason = "operator:" + reasonOf(request, "manual");
        log.warn("[Safety] operator safe-mode entry. reason={}", reason);
        safeMode.enter(reason, true);
        return ResponseEntity.ok(current());
    }

    @PostMapping("/safe-mode/exit")
    public ResponseEntity<SafetyState> exitSafeMode() {
        if (!safeMode.isActive()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(current());
        }
        if (panicStop.isActive()) {
            log.warn("[Safety] safe-mode exit refused while panic stop is latched.");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(current());
        }
        safeMode.exit(true);
        return ResponseEntity.ok(current());
    }

    @PostMapping("/panic")
    public ResponseEntity<SafetyState> panic(@RequestBody(required = false) OperatorRequest request) {
        if (panicStop.isActive()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(current());
        }
        panicStop.trigger(PanicStopType.MANUAL, reasonOf(request, "operator panic"));
        return ResponseEntity.ok(current());
    }

    @PostMapping("/panic/reset")
    public ResponseEntity<SafetyState> resetPanic() {
        if (!panicStop.isActive()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(current());
        }
        panicStop.reset();
        return ResponseEntity.ok(current());
    }

    private SafetyState current() {
        return new SafetyState(safeMode.getState(), panicStop.getReason().orElse(null));
    }

    private static String reasonOf(OperatorRequest request, String fallback) {
        return request != null && request.reason() != null && !request.reason().isBlank()
            ? request.reason() : fallback;
    }

    public record OperatorRequest(@JsonProperty("reason") String reason) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SafetyState(
        @JsonProperty("safeMode")  SafeModeState safeMode,
        @JsonProperty("panicStop") PanicStopReason panicStop
    ) {}
}
