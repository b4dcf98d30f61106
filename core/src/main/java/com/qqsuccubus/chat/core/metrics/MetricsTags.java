package com.qqsuccubus.chat.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the event name (send_message, typing, ...).
     */
    public static final String EVENT = "event";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for the storage operation.
     */
    public static final String OPERATION = "operation";

    /**
     * Tag key for the operation outcome (success/failure).
     */
    public static final String OUTCOME = "outcome";
}
