package com.example.accounts.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The account a login completed for. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountIdentity {
    private Long id;
    private String username;
    private String firstName;
}
