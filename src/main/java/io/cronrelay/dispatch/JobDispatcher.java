package io.cronrelay.dispatch;

import io.cronrelay.model.LineageContext;
import io.cronrelay.model.ScheduledJob;

/**
 * Invokes a job's endpoint exactly once and classifies the outcome. Implementations never retry
 * and report failures as values rather than exceptions.
 */
public interface JobDispatcher {
    DispatchResult dispatch(ScheduledJob job, LineageContext parent);
}
