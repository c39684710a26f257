package com.flagship.audit_trail.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RevisionActivityUserEntity {
    UUID revisionId;
    UUID revisionActivityId;
    UUID userId;
    Instant createdAt;

    RevisionEntity revision;
    ActivityEntity revisionActivity;
    UserEntity user;
}
