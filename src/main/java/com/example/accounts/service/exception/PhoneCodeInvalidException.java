package com.example.accounts.service.exception;

public class PhoneCodeInvalidException extends AccountClientException {

    public PhoneCodeInvalidException(String message) {
        super(message);
    }
}
