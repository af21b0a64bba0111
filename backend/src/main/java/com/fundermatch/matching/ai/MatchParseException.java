package com.fundermatch.matching.ai;

public class MatchParseException extends RuntimeException {
    public MatchParseException(String message) {
        super(message);
    }

    public MatchParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
