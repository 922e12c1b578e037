package com.example.accounts.controllers.impl;

import com.example.accounts.controllers.AccountClient;
import com.example.accounts.dto.AccountIdentity;
import com.example.accounts.service.exception.AccountClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Account client backed by the login gateway's REST API. One instance per session reference.
 */
@Slf4j
public class GatewayAccountClient implements AccountClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String sessionRef;

    public GatewayAccountClient(RestTemplate restTemplate, String baseUrl, String sessionRef) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.sessionRef = sessionRef;
    }

    @Override
    public String getSessionRef() {
        return sessionRef;
    }

    @Override
    public boolean isAuthorized() {
        AuthorizationResponse response = post("authorized", new SessionRequest(sessionRef), AuthorizationResponse.class);
        return response != null && response.authorized();
    }

    @Override
    public String requestCode(String phoneNumber) {
        SendCodeResponse response = post("send-code", new SendCodeRequest(sessionRef, phoneNumber), SendCodeResponse.class);
        if (response == null || response.phoneCodeHash() == null) {
            throw new AccountClientException("send-code returned no phone code hash");
        }
        return response.phoneCodeHash();
    }

    @Override
    public AccountIdentity signInWithCode(String phoneNumber, String code, String codeToken) {
        return post("sign-in", new SignInRequest(sessionRef, phoneNumber, code, codeToken), AccountIdentity.class);
    }

    @Override
    public AccountIdentity signInWithPassword(String password) {
        return post("check-password", new PasswordRequest(sessionRef, password), AccountIdentity.class);
    }

    @Override
    public void disconnect() {
        try {
            restTemplate.postForEntity(baseUrl + "/sessions/disconnect", new SessionRequest(sessionRef), Void.class);
        } catch (RestClientException e) {
            log.warn("Failed to disconnect gateway session {}: {}", sessionRef, e.getMessage());
        }
    }

    private <T> T post(String operation, Object body, Class<T> responseType) {
        try {
            return restTemplate.postForObject(baseUrl + "/sessions/" + operation, body, responseType);
        } catch (RestClientException e) {
            throw GatewayErrorMapper.map(operation, e);
        }
    }

    private record SessionRequest(String session) {}

    private record SendCodeRequest(String session, String phoneNumber) {}

    private record SignInRequest(String session, String phoneNumber, String code, String phoneCodeHash) {}

    private record PasswordRequest(String session, String password) {}

    record AuthorizationResponse(boolean authorized) {}

    record SendCodeResponse(String phoneCodeHash) {}
}
