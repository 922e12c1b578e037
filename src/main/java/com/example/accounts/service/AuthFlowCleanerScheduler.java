package com.example.accounts.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthFlowCleanerScheduler {

    private final AuthenticationOrchestrator orchestrator;

    @Scheduled(fixedDelay = 60_000)
    public void cleanupExpired() {
        int expired = orchestrator.expireStaleFlows(LocalDateTime.now());
        if (expired > 0) {
            log.info("Expired {} abandoned login flows", expired);
        }
    }
}
