package com.flagship.recurring_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CreateAccountRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @NotBlank(message = "Account number is required")
    @Size(max = 50)
    @JsonProperty("account_number")
    String accountNumber;

    @Size(max = 60)
    @JsonProperty("name")
    String name;
}
