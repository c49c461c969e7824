package com.flagship.recurring_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class AccountListResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("accounts")
    List<AccountResponse> accounts;

    @JsonProperty("total_balance")
    BigDecimal totalBalance;
}
