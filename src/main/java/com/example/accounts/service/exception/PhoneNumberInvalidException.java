package com.example.accounts.service.exception;

public class PhoneNumberInvalidException extends AccountClientException {

    public PhoneNumberInvalidException(String message) {
        super(message);
    }
}
