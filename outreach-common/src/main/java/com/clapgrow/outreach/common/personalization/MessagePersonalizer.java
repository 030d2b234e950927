package com.clapgrow.outreach.common.personalization;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders message templates against recipient attributes and validates template syntax.
 *
 * <p>{@link #render} is a pure function: identical inputs give identical output and
 * missing attributes never fail, they fall back (see {@link Placeholder}).
 * Tokens that are not recognized placeholders are left as-is; {@link #validate} is what
 * rejects them, once, before a campaign may run.
 */
public class MessagePersonalizer {

    /** Channel limit is 10,000 characters; the rest is headroom for substitution growth. */
    public static final int MAX_TEMPLATE_LENGTH = 9000;

    private static final Pattern TOKEN = Pattern.compile("\\{[^}]+\\}");

    public String render(String template, RecipientProfile profile) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = TOKEN.matcher(template);
        return matcher.replaceAll(match -> Matcher.quoteReplacement(
            Placeholder.fromToken(match.group())
                .map(placeholder -> placeholder.resolve(profile))
                .orElse(match.group())));
    }

    public TemplateValidationResult validate(String template) {
        return validate(template, true);
    }

    /**
     * Validate a template. When personalization is disabled the template is sent verbatim,
     * so any placeholder in it is an error.
     */
    public TemplateValidationResult validate(String template, boolean personalizationEnabled) {
        if (template == null || template.isBlank()) {
            return TemplateValidationResult.invalid(List.of("Template cannot be empty"));
        }

        List<String> errors = new ArrayList<>();
        Set<String> tokens = new LinkedHashSet<>();
        Matcher matcher = TOKEN.matcher(template);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }

        for (String token : tokens) {
            if (Placeholder.fromToken(token).isEmpty()) {
                errors.add("Unsupported variable: " + token);
            } else if (!personalizationEnabled) {
                errors.add("Variable " + token + " requires personalization to be enabled");
            }
        }

        if (template.length() > MAX_TEMPLATE_LENGTH) {
            errors.add("Template too long (max " + MAX_TEMPLATE_LENGTH + " characters)");
        }

        return errors.isEmpty() ? TemplateValidationResult.ok() : TemplateValidationResult.invalid(errors);
    }
}
