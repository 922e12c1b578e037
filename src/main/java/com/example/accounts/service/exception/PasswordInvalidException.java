package com.example.accounts.service.exception;

public class PasswordInvalidException extends AccountClientException {

    public PasswordInvalidException(String message) {
        super(message);
    }
}
