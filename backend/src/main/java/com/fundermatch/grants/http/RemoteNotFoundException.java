package com.fundermatch.grants.http;

public class RemoteNotFoundException extends RemoteApiException {
    public RemoteNotFoundException(String message) {
        super(404, message);
    }
}
