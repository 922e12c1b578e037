package com.example.accounts.model;

/** What kind of text the bot expects next from a user. */
public enum ConversationState {
    IDLE,
    AWAITING_PHONE,
    AWAITING_CODE,
    AWAITING_TWO_FACTOR
}
