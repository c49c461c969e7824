package com.flagship.recurring_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.account.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("name")
    String name;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .userId(account.getUserId())
            .accountNumber(account.getAccountNumber())
            .name(account.getName())
            .balance(account.getBalance())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
