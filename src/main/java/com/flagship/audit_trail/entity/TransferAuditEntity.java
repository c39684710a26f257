package com.flagship.audit_trail.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Row from either side of a document transfer (the "from" table or the "to" table).
 * Which side it came from is supplied by the caller on conversion.
 */
@Value
@Builder
public class TransferAuditEntity {
    UUID matterId;
    UUID documentId;
    UUID matterDocumentActivityId;
    UUID userId;
    Instant createdAt;

    MatterEntity matter;
    DocumentEntity document;
    ActivityEntity matterDocumentActivity;
    UserEntity user;
}
