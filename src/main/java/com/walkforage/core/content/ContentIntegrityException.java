package com.walkforage.core.content;

import java.util.List;

/**
 * Static content is broken (malformed table, duplicate id, cycle, dangling reference, ...).
 * Fatal: the content must be fixed before it ships.
 */
public class ContentIntegrityException extends RuntimeException {

    private final List<String> violations;

    public ContentIntegrityException(List<String> violations) {
        super(buildMessage(violations));
        this.violations = (violations != null) ? List.copyOf(violations) : List.of();
    }

    public ContentIntegrityException(String violation, Throwable cause) {
        super(violation, cause);
        this.violations = List.of(violation);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        if (violations == null || violations.isEmpty()) return "Content integrity violated";
        if (violations.size() == 1) return violations.get(0);
        return violations.size() + " content integrity violations, first: " + violations.get(0);
    }
}
