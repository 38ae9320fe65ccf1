package io.github.drompincen.bandwidth.protocol.api;

/**
 * How much of a task's estimate a projection managed to place.
 * {@link #PARTIAL} means the horizon ran out mid-task: dates are set but the task
 * is not fully scheduled.
 */
public enum PlacementState {
    UNSCHEDULED, PARTIAL, SCHEDULED
}
