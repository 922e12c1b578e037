package com.example.accounts.controllers;

public interface AccountClientFactory {

    /**
     * Opens a connection to the account network bound to the given session reference.
     * An existing authorized session under the same reference is reused.
     */
    AccountClient connect(String sessionRef);
}
