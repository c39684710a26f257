package com.flagship.audit_trail.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Persistence-shaped matter row.
 */
@Value
@Builder
public class MatterEntity {
    UUID id;
    String description;
    boolean archived;
    boolean deleted;
    Instant creationDate;
}
