package com.example.accounts.service.exception;

import lombok.Getter;

/** The provider asks to wait before the next attempt. */
@Getter
public class FloodWaitException extends AccountClientException {

    private final long seconds;

    public FloodWaitException(long seconds) {
        super("Flood wait of " + seconds + " seconds");
        this.seconds = seconds;
    }
}
