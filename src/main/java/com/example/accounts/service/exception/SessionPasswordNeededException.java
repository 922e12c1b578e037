package com.example.accounts.service.exception;

public class SessionPasswordNeededException extends AccountClientException {

    public SessionPasswordNeededException(String message) {
        super(message);
    }
}
