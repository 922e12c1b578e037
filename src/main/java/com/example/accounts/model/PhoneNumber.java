package com.example.accounts.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "numbers",
        indexes = @Index(name = "idx_numbers_user_phone", columnList = "user_id, phone_number")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PhoneNumber {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "phone_number", nullable = false)
    private String phoneNumber;

    @Column(name = "is_authenticated")
    private boolean authenticated;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PhoneNumberStatus status;

    @Column(name = "added_at")
    private LocalDateTime addedAt;

    @Column(name = "last_login")
    private LocalDateTime lastLogin;
}
