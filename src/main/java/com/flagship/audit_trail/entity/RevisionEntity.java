package com.flagship.audit_trail.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RevisionEntity {
    UUID id;
    int revisionNumber;
    UUID documentId;
    Instant creationDate;
    Instant modificationDate;
    boolean deleted;
}
