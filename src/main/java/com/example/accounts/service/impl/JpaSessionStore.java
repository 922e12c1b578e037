package com.example.accounts.service.impl;

import com.example.accounts.model.PhoneNumber;
import com.example.accounts.model.PhoneNumberStatus;
import com.example.accounts.model.TelegramUser;
import com.example.accounts.model.UserSession;
import com.example.accounts.repository.PhoneNumberRepository;
import com.example.accounts.repository.TelegramUserRepository;
import com.example.accounts.repository.UserSessionRepository;
import com.example.accounts.service.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaSessionStore implements SessionStore {

    private final TelegramUserRepository userRepo;
    private final PhoneNumberRepository numberRepo;
    private final UserSessionRepository sessionRepo;

    @Override
    @Transactional
    public void upsertUser(Long userId, String username, String firstName, String lastName) {
        TelegramUser user = userRepo.findById(userId)
                .orElseGet(() -> TelegramUser.builder()
                        .userId(userId)
                        .createdAt(LocalDateTime.now())
                        .build());
        user.setUsername(username);
        user.setFirstName(firstName);
        user.setLastName(lastName);
        user.setActive(true);
        userRepo.save(user);
    }

    @Override
    @Transactional
    public Long insertPhoneNumber(Long userId, String phoneNumber) {
        PhoneNumber saved = numberRepo.save(PhoneNumber.builder()
                .userId(userId)
                .phoneNumber(phoneNumber)
                .authenticated(false)
                .status(PhoneNumberStatus.PENDING)
                .addedAt(LocalDateTime.now())
                .build());
        log.debug("Phone number record {} added for user {}", saved.getId(), userId);
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public List<PhoneNumber> listPhoneNumbers(Long userId) {
        return numberRepo.findAllByUserIdOrderByAddedAtDescIdDesc(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PhoneNumber> findPhoneNumber(Long userId, Long recordId) {
        return numberRepo.findByIdAndUserId(recordId, userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PhoneNumber> findLatestPhoneNumber(Long userId, String phoneNumber) {
        return numberRepo.findFirstByUserIdAndPhoneNumberOrderByAddedAtDescIdDesc(userId, phoneNumber);
    }

    @Override
    @Transactional
    public void updatePhoneStatus(Long recordId, PhoneNumberStatus status, boolean authenticated) {
        numberRepo.findById(recordId).ifPresentOrElse(number -> {
            number.setStatus(status);
            number.setAuthenticated(authenticated);
            number.setLastLogin(LocalDateTime.now());
            numberRepo.save(number);
        }, () -> log.warn("Phone number record {} not found, status {} not stored", recordId, status));
    }

    @Override
    @Transactional
    public void upsertSession(Long userId, String phoneNumber, String sessionRef) {
        UserSession session = sessionRepo.findByUserIdAndPhoneNumber(userId, phoneNumber)
                .orElseGet(() -> UserSession.builder()
                        .userId(userId)
                        .phoneNumber(phoneNumber)
                        .build());
        session.setSessionRef(sessionRef);
        session.setCreatedAt(LocalDateTime.now());
        session.setActive(true);
        sessionRepo.save(session);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> getActiveSessionRef(Long userId, String phoneNumber) {
        return sessionRepo.findByUserIdAndPhoneNumberAndActiveTrue(userId, phoneNumber)
                .map(UserSession::getSessionRef);
    }
}
