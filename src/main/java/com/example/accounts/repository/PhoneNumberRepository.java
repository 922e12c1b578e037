package com.example.accounts.repository;

import com.example.accounts.model.PhoneNumber;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PhoneNumberRepository extends JpaRepository<PhoneNumber, Long> {

    List<PhoneNumber> findAllByUserIdOrderByAddedAtDescIdDesc(Long userId);

    Optional<PhoneNumber> findByIdAndUserId(Long id, Long userId);

    Optional<PhoneNumber> findFirstByUserIdAndPhoneNumberOrderByAddedAtDescIdDesc(Long userId, String phoneNumber);
}
