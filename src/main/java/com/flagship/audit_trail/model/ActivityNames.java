package com.flagship.audit_trail.model;

/**
 * Canonical activity names shared across the activity scopes.
 */
public final class ActivityNames {

    public static final String CREATED = "CREATED";
    public static final String SAVED = "SAVED";
    public static final String DELETED = "DELETED";
    public static final String RESTORED = "RESTORED";
    public static final String ARCHIVED = "ARCHIVED";
    public static final String UNARCHIVED = "UNARCHIVED";
    public static final String VIEWED = "VIEWED";
    public static final String CHECKED_IN = "CHECKED IN";
    public static final String CHECKED_OUT = "CHECKED OUT";
    public static final String MOVED = "MOVED";
    public static final String COPIED = "COPIED";

    private ActivityNames() {
        // Constants holder
    }
}
