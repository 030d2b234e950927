package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.retry.FailureClassification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies delivery-channel failures once, where the channel error is interpreted.
 * The retry loop only ever sees the resulting {@link FailureClassification}.
 *
 * Classification rules, in order:
 * - RATE_LIMIT: HTTP 429, "rate limit", "too many requests"
 * - PERMANENT: HTTP 400/401/403/404/422; authorization, not-found, blocked or suspended
 *   recipient and input validation keywords in the channel's answer: the response body, or
 *   the error message of another 4xx response
 * - TRANSIENT: HTTP 5xx and everything else (timeouts, connection failures)
 *
 * Transport errors carry no status and no body. Their messages hold host names and socket
 * details, so they are never matched against the permanent keywords.
 */
@Service
@Slf4j
public class FailureClassifier {

    private static final Set<Integer> PERMANENT_STATUS_CODES = Set.of(400, 401, 403, 404, 422);

    private static final List<String> RATE_LIMIT_KEYWORDS = List.of("rate limit", "too many requests");

    private static final List<String> PERMANENT_KEYWORDS = List.of(
        // authorization
        "unauthorized", "forbidden", "permission", "authentication",
        // not found
        "not found", "user_not_found",
        // recipient state
        "blocked", "suspended", "private",
        // input validation
        "invalid", "validation", "required", "format"
    );

    public FailureClassification classify(Integer httpStatusCode, String errorMessage, String responseBody) {
        if (httpStatusCode != null) {
            if (httpStatusCode == 429) {
                return FailureClassification.RATE_LIMIT;
            }
            if (PERMANENT_STATUS_CODES.contains(httpStatusCode)) {
                return FailureClassification.PERMANENT;
            }
            if (httpStatusCode >= 500) {
                return FailureClassification.TRANSIENT;
            }
        }

        String message = lower(errorMessage);
        String body = lower(responseBody);

        if (containsAny(message, RATE_LIMIT_KEYWORDS) || containsAny(body, RATE_LIMIT_KEYWORDS)) {
            return FailureClassification.RATE_LIMIT;
        }
        boolean clientError = httpStatusCode != null && httpStatusCode >= 400 && httpStatusCode < 500;
        if (containsAny(body, PERMANENT_KEYWORDS) || (clientError && containsAny(message, PERMANENT_KEYWORDS))) {
            return FailureClassification.PERMANENT;
        }

        log.debug("Classified failure as transient (status={}, message={})", httpStatusCode, errorMessage);
        return FailureClassification.TRANSIENT;
    }

    private static String lower(String text) {
        return text != null ? text.toLowerCase(Locale.ROOT) : "";
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
