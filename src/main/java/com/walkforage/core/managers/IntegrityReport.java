package com.walkforage.core.managers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a content integrity pass. Errors block startup, warnings are only printed.
 */
public final class IntegrityReport {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    void error(String msg) {
        errors.add(msg);
    }

    void warn(String msg) {
        warnings.add(msg);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasErrorContaining(String fragment) {
        return errors.stream().anyMatch(e -> e.contains(fragment));
    }

    public boolean hasWarningContaining(String fragment) {
        return warnings.stream().anyMatch(w -> w.contains(fragment));
    }

    @Override
    public String toString() {
        return "IntegrityReport{errors=" + errors.size() + ", warnings=" + warnings.size() + "}";
    }
}
