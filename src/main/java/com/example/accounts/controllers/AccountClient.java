package com.example.accounts.controllers;

import com.example.accounts.dto.AccountIdentity;
import com.example.accounts.service.exception.AccountClientException;
import com.example.accounts.service.exception.FloodWaitException;
import com.example.accounts.service.exception.PasswordInvalidException;
import com.example.accounts.service.exception.PhoneCodeExpiredException;
import com.example.accounts.service.exception.PhoneCodeInvalidException;
import com.example.accounts.service.exception.PhoneNumberInvalidException;
import com.example.accounts.service.exception.SessionPasswordNeededException;

/**
 * A live connection for one phone-based account. Every method may also throw a plain
 * {@link AccountClientException} for provider failures outside the listed ones.
 */
public interface AccountClient {

    String getSessionRef();

    boolean isAuthorized();

    /**
     * Asks the provider to deliver a one-time code.
     *
     * @return correlation token to pass back on sign-in
     * @throws PhoneNumberInvalidException the provider rejects the number
     * @throws FloodWaitException too many attempts
     */
    String requestCode(String phoneNumber);

    /**
     * @throws PhoneCodeInvalidException wrong code
     * @throws PhoneCodeExpiredException code no longer valid
     * @throws SessionPasswordNeededException the account has a second factor
     */
    AccountIdentity signInWithCode(String phoneNumber, String code, String codeToken);

    /**
     * @throws PasswordInvalidException wrong second-factor password
     */
    AccountIdentity signInWithPassword(String password);

    /** Best effort, never throws. */
    void disconnect();
}
