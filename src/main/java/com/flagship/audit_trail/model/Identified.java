package com.flagship.audit_trail.model;

import java.util.UUID;

/**
 * A record with a durable identifier that audit associations can reference.
 */
public interface Identified {

    UUID getId();

    /**
     * Human-readable label used in audit summaries.
     */
    String displayLabel();
}
