package com.example.accounts.model;

public enum PhoneNumberStatus {
    PENDING,
    AUTHENTICATED,
    FAILED;

    public String label() {
        return name().toLowerCase();
    }
}
