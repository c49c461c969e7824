package com.flagship.recurring_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.ledger.ImportResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ImportResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("imported")
    int imported;

    @JsonProperty("balance")
    BigDecimal balance;

    public static ImportResponse from(ImportResult result) {
        return ImportResponse.builder()
            .accountId(result.getAccountId())
            .imported(result.getCount())
            .balance(result.getBalance())
            .build();
    }
}
