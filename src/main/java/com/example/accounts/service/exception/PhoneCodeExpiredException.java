package com.example.accounts.service.exception;

public class PhoneCodeExpiredException extends AccountClientException {

    public PhoneCodeExpiredException(String message) {
        super(message);
    }
}
