package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.retry.FailureClassification;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier();

    @Test
    void testClassify_StatusCodeTakesPrecedence() {
        assertEquals(FailureClassification.RATE_LIMIT, classifier.classify(429, "anything", null));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(401, "gateway hiccup", null));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(404, null, null));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(422, null, null));
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(503, "invalid upstream", null));
    }

    @Test
    void testClassify_RateLimitKeywords_AnyWhere() {
        assertEquals(FailureClassification.RATE_LIMIT, classifier.classify(null, "Rate limit exceeded", null));
        assertEquals(FailureClassification.RATE_LIMIT, classifier.classify(409, null, "Too Many Requests"));
    }

    @Test
    void testClassify_PermanentKeywordsInResponseBody_Permanent() {
        assertEquals(FailureClassification.PERMANENT,
            classifier.classify(null, "Delivery failed", "{\"code\":\"USER_NOT_FOUND\"}"));
        assertEquals(FailureClassification.PERMANENT,
            classifier.classify(302, "moved", "{\"error\":\"Recipient has blocked you\"}"));
    }

    @Test
    void testClassify_PermanentKeywordsInMessageOfOtherClientError_Permanent() {
        assertEquals(FailureClassification.PERMANENT, classifier.classify(409, "Account is private", null));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(410, "Recipient suspended", null));
    }

    @Test
    void testClassify_TransportErrorMentioningKeyword_Transient() {
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(null,
            "Delivery gateway unreachable: Connection refused: private-gw/10.0.0.5:8090", null));
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(null,
            "Delivery failed: Invalid HTTP response format", null));
    }

    @Test
    void testClassify_NothingRecognised_Transient() {
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(null, "Connection reset", null));
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(null, null, null));
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(302, "moved", null));
    }
}
