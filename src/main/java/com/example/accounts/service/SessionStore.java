package com.example.accounts.service;

import com.example.accounts.model.PhoneNumber;
import com.example.accounts.model.PhoneNumberStatus;

import java.util.List;
import java.util.Optional;

/**
 * Durable records of bot users, submitted phone numbers and authenticated sessions.
 */
public interface SessionStore {

    void upsertUser(Long userId, String username, String firstName, String lastName);

    /** Records a submitted phone number in {@link PhoneNumberStatus#PENDING} state and returns its id. */
    Long insertPhoneNumber(Long userId, String phoneNumber);

    /** Newest first. */
    List<PhoneNumber> listPhoneNumbers(Long userId);

    Optional<PhoneNumber> findPhoneNumber(Long userId, Long recordId);

    Optional<PhoneNumber> findLatestPhoneNumber(Long userId, String phoneNumber);

    /** Sets status and authentication flag and stamps the last login time. */
    void updatePhoneStatus(Long recordId, PhoneNumberStatus status, boolean authenticated);

    /** Replaces any existing session for the same user and phone number. */
    void upsertSession(Long userId, String phoneNumber, String sessionRef);

    Optional<String> getActiveSessionRef(Long userId, String phoneNumber);
}
