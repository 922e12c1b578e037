package com.example.accounts.service;

/**
 * Result of one login step. {@code detail} carries provider text for logs and is never shown to users.
 */
public record AuthOutcome(Status status, Reason reason, long waitSeconds, String detail) {

    public enum Status {
        CODE_SENT,
        ALREADY_AUTHORIZED,
        SUCCESS,
        TWO_FACTOR_REQUIRED,
        /** rejected input, the same step may be retried */
        RETRYABLE,
        INVALID_PHONE,
        RATE_LIMITED,
        NO_PENDING,
        FAILED
    }

    public enum Reason {
        NONE,
        CODE_INVALID,
        CODE_EXPIRED,
        PASSWORD_INVALID,
        PROVIDER_ERROR
    }

    public static AuthOutcome codeSent() {
        return of(Status.CODE_SENT);
    }

    public static AuthOutcome alreadyAuthorized() {
        return of(Status.ALREADY_AUTHORIZED);
    }

    public static AuthOutcome success() {
        return of(Status.SUCCESS);
    }

    public static AuthOutcome twoFactorRequired() {
        return of(Status.TWO_FACTOR_REQUIRED);
    }

    public static AuthOutcome noPending() {
        return of(Status.NO_PENDING);
    }

    public static AuthOutcome retryable(Reason reason) {
        return new AuthOutcome(Status.RETRYABLE, reason, 0, null);
    }

    public static AuthOutcome invalidPhone(String detail) {
        return new AuthOutcome(Status.INVALID_PHONE, Reason.NONE, 0, detail);
    }

    public static AuthOutcome rateLimited(long waitSeconds) {
        return new AuthOutcome(Status.RATE_LIMITED, Reason.NONE, waitSeconds, null);
    }

    public static AuthOutcome failed(Reason reason, String detail) {
        return new AuthOutcome(Status.FAILED, reason, 0, detail);
    }

    private static AuthOutcome of(Status status) {
        return new AuthOutcome(status, Reason.NONE, 0, null);
    }

    public boolean is(Status expected) {
        return status == expected;
    }
}
