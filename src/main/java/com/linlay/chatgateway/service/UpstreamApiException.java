package com.linlay.chatgateway.service;

/**
 * Any non-success response or transport failure while talking to the upstream service.
 */
public class UpstreamApiException extends RuntimeException {

    private final Integer statusCode;

    public UpstreamApiException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    /**
     * @return upstream HTTP status, or {@code null} for transport-level failures
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
