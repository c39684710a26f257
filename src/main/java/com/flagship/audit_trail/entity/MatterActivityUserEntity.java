package com.flagship.audit_trail.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Junction row linking a matter, a matter activity and a user.
 *
 * Navigation rows are null unless the loader attached them.
 */
@Value
@Builder
public class MatterActivityUserEntity {
    UUID matterId;
    UUID matterActivityId;
    UUID userId;
    Instant createdAt;

    MatterEntity matter;
    ActivityEntity matterActivity;
    UserEntity user;
}
