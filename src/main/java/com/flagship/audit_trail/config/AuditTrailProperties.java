package com.flagship.audit_trail.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Reporting and batch-conversion settings for the audit trail.
 *
 * <p>Note: Bean created via {@link com.flagship.audit_trail.AuditTrailApplication}.
 */
@ConfigurationProperties(prefix = "audit-trail")
@Validated
public class AuditTrailProperties {

    /** Activities newer than this many days count as recent. */
    @Positive(message = "Recent window must be positive")
    private int recentWindowDays = 7;

    /** Zone used when rendering audit messages. */
    @NotBlank(message = "Display zone is required")
    private String displayZone = "UTC";

    /** Skip and log invalid rows during batch conversion instead of failing the batch. */
    private boolean skipInvalidOnBatch = true;

    public int getRecentWindowDays() {
        return recentWindowDays;
    }

    public void setRecentWindowDays(int recentWindowDays) {
        this.recentWindowDays = recentWindowDays;
    }

    public String getDisplayZone() {
        return displayZone;
    }

    public void setDisplayZone(String displayZone) {
        this.displayZone = displayZone;
    }

    public ZoneId displayZoneId() {
        return ZoneId.of(displayZone);
    }

    @AssertTrue(message = "Display zone must be a valid zone id")
    public boolean isDisplayZoneResolvable() {
        if (displayZone == null || displayZone.isBlank()) {
            // Reported by @NotBlank
            return true;
        }
        try {
            ZoneId.of(displayZone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    public boolean isSkipInvalidOnBatch() {
        return skipInvalidOnBatch;
    }

    public void setSkipInvalidOnBatch(boolean skipInvalidOnBatch) {
        this.skipInvalidOnBatch = skipInvalidOnBatch;
    }
}
