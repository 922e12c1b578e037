package com.example.accounts.service.exception;

/**
 * Failure reported by the account client. The message may carry raw provider
 * detail and is meant for logs only.
 */
public class AccountClientException extends RuntimeException {

    public AccountClientException(String message) {
        super(message);
    }

    public AccountClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
