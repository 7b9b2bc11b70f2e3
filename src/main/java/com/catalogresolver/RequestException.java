package com.catalogresolver;

/**
 * A required request failed. {@code statusCode} is 0 when the transport failed before a response arrived.
 */
public class RequestException extends CatalogException {

    private final int statusCode;
    private final String reason;

    public RequestException(int statusCode, String reason) {
        super("Error while fetching results: " + statusCode + " " + reason);
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public RequestException(String reason, Throwable cause) {
        super("Error while fetching results: " + reason, cause);
        this.statusCode = 0;
        this.reason = reason;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReason() {
        return reason;
    }
}
