package com.flagship.audit_trail.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class DocumentEntity {
    UUID id;
    String fileName;
    String extension;
    boolean checkedOut;
    boolean deleted;
    Instant creationDate;
}
