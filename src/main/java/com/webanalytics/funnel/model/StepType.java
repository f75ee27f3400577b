package com.webanalytics.funnel.model;

/**
 * Kind of match a funnel step performs against recorded events.
 */
public enum StepType {
    /** A page view whose path equals or contains the step target. */
    PAGE_VIEW,
    /** A named event whose name equals the step target. */
    EVENT,
    /** A named event additionally constrained by property conditions. */
    CUSTOM
}
