package com.example.accounts.controllers.impl;

import com.example.accounts.config.BotConfig;
import com.example.accounts.controllers.AccountClient;
import com.example.accounts.controllers.AccountClientFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayAccountClientFactory implements AccountClientFactory {

    private final RestTemplate restTemplate;
    private final BotConfig config;

    @Override
    public AccountClient connect(String sessionRef) {
        String baseUrl = config.getGatewayUrl();
        try {
            restTemplate.postForEntity(
                    baseUrl + "/sessions/connect",
                    new ConnectRequest(sessionRef, config.getApiId(), config.getApiHash()),
                    Void.class
            );
        } catch (RestClientException e) {
            throw GatewayErrorMapper.map("connect", e);
        }
        log.debug("Gateway session {} connected", sessionRef);
        return new GatewayAccountClient(restTemplate, baseUrl, sessionRef);
    }

    private record ConnectRequest(String session, String apiId, String apiHash) {}
}
