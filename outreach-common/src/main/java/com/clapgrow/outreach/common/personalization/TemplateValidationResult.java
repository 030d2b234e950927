package com.clapgrow.outreach.common.personalization;

import java.util.List;

/**
 * Result of {@link MessagePersonalizer#validate}. {@code errors} is empty when valid.
 */
public record TemplateValidationResult(boolean valid, List<String> errors) {

    public TemplateValidationResult {
        errors = List.copyOf(errors);
    }

    public static TemplateValidationResult ok() {
        return new TemplateValidationResult(true, List.of());
    }

    public static TemplateValidationResult invalid(List<String> errors) {
        return new TemplateValidationResult(false, errors);
    }

    public String errorSummary() {
        return String.join(", ", errors);
    }
}
