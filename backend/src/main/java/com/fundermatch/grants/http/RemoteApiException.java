package com.fundermatch.grants.http;

public class RemoteApiException extends RuntimeException {
    private final int statusCode;

    public RemoteApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the grant-data API, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
