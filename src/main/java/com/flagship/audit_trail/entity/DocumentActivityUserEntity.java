package com.flagship.audit_trail.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class DocumentActivityUserEntity {
    UUID documentId;
    UUID documentActivityId;
    UUID userId;
    Instant createdAt;

    DocumentEntity document;
    ActivityEntity documentActivity;
    UserEntity user;
}
