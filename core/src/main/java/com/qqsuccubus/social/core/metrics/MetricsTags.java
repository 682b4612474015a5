package com.qqsuccubus.social.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    /**
     * Tag key for a sub-kind (reaction transition kind, etc.).
     */
    public static final String TYPE = "type";

    public static final String REASON = "reason";

    public static final String RESULT = "result";

    /**
     * Tag key for the inbound event name.
     */
    public static final String EVENT = "event";

}
