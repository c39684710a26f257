package com.flagship.audit_trail.entity;

import lombok.Value;

import java.util.UUID;

@Value
public class UserEntity {
    UUID id;
    String name;
}
