package com.flagship.audit_trail.entity;

import lombok.Value;

import java.util.UUID;

/**
 * Activity lookup row. The same shape backs all four activity tables.
 */
@Value
public class ActivityEntity {
    UUID id;
    String activity;
}
