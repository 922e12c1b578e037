package com.example.accounts.repository;

import com.example.accounts.model.UserSession;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserSessionRepository extends JpaRepository<UserSession, Long> {

    Optional<UserSession> findByUserIdAndPhoneNumber(Long userId, String phoneNumber);

    Optional<UserSession> findByUserIdAndPhoneNumberAndActiveTrue(Long userId, String phoneNumber);
}
