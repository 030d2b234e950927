package com.clapgrow.outreach.common.delivery;

/**
 * Thrown by a {@link DeliveryChannelClient} when a message could not be delivered.
 * Carries the raw HTTP details, if any, so the failure can be classified.
 */
public class DeliveryException extends RuntimeException {

    private final Integer httpStatusCode;
    private final String responseBody;

    public DeliveryException(String message) {
        this(message, null, null, null);
    }

    public DeliveryException(String message, Integer httpStatusCode, String responseBody) {
        this(message, httpStatusCode, responseBody, null);
    }

    public DeliveryException(String message, Integer httpStatusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }

    public Integer getHttpStatusCode() {
        return httpStatusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
