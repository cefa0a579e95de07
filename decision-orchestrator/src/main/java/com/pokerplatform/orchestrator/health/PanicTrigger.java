package com.pokerplatform.orchestrator.health;

import com.pokerplatform.common.health.PanicStopType;

/**
 * Narrow capability for forcing a panic stop. Handed to telemetry recorders so they can
 * stop play without depending on the whole controller.
 */
@FunctionalInterface
public interface PanicTrigger {

    void trigger(PanicStopType type, String detail);
}
