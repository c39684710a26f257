package com.flagship.audit_trail.validation;

import com.flagship.audit_trail.normalization.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Professional naming rules for user display names.
 */
public final class UserNameRules {

    public static final int MIN_LENGTH = 2;
    public static final int MAX_LENGTH = 50;

    private static final Set<String> RESERVED_NAMES = Set.of(
        // system accounts
        "admin", "administrator", "system", "root", "sa", "sysadmin",
        // service accounts
        "service", "daemon", "process", "worker", "scheduler",
        // roles
        "user", "guest", "anonymous", "public", "default",
        // protocol and technical terms
        "api", "rest", "soap", "json", "xml", "http", "https",
        "www", "mail", "email", "ftp", "ssh", "ssl", "tls",
        // domain terms
        "adms", "matter", "document", "revision", "activity",
        // security
        "security", "auth", "authentication", "authorization",
        "token", "session", "login", "logout", "password",
        // mailbox names
        "support", "help", "info", "contact", "sales", "marketing",
        "noreply", "no-reply", "postmaster", "webmaster",
        // placeholders
        "null", "undefined", "none", "empty", "void", "test",
        // file system
        "bin", "boot", "dev", "etc", "home", "lib", "mnt", "opt",
        "proc", "run", "srv", "tmp", "usr", "var", "windows",
        // database
        "database", "db", "sql", "select", "insert", "update", "delete"
    );

    private UserNameRules() {
        // Utility class
    }

    public static boolean isReserved(String name) {
        return RESERVED_NAMES.contains(TextNormalizer.comparisonKey(name));
    }

    public static Set<String> reservedNames() {
        return RESERVED_NAMES;
    }

    public static boolean isValid(String name) {
        if (TextNormalizer.isBlank(name)) {
            return false;
        }
        String trimmed = name.strip();
        return hasValidLength(trimmed)
            && !isReserved(trimmed)
            && TextFormat.shortTextProblem(trimmed) == null;
    }

    public static List<ValidationViolation> validate(String name, String fieldName) {
        IdentifierRules.requireFieldName(fieldName);
        List<ValidationViolation> violations = new ArrayList<>();
        if (TextNormalizer.isBlank(name)) {
            violations.add(ValidationViolation.of(fieldName + " is required and cannot be empty.", fieldName));
            return violations;
        }
        String trimmed = name.strip();
        if (!hasValidLength(trimmed)) {
            violations.add(ValidationViolation.of(
                String.format("%s must be between %d and %d characters.", fieldName, MIN_LENGTH, MAX_LENGTH),
                fieldName));
        }
        if (isReserved(trimmed)) {
            violations.add(ValidationViolation.of(
                fieldName + " is a reserved name and cannot be used.", fieldName));
        }
        String formatProblem = TextFormat.shortTextProblem(trimmed);
        if (formatProblem != null) {
            violations.add(ValidationViolation.of(fieldName + " " + formatProblem, fieldName));
        }
        return violations;
    }

    private static boolean hasValidLength(String trimmed) {
        return trimmed.length() >= MIN_LENGTH && trimmed.length() <= MAX_LENGTH;
    }
}
