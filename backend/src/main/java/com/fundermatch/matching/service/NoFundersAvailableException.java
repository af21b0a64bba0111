package com.fundermatch.matching.service;

public class NoFundersAvailableException extends RuntimeException {
    public NoFundersAvailableException(String message) {
        super(message);
    }
}
