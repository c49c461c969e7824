package com.flagship.recurring_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.account.AccountSnapshotService.SnapshotImport;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SnapshotImportResponse {

    @JsonProperty("account")
    AccountResponse account;

    @JsonProperty("templates")
    int templates;

    @JsonProperty("transactions")
    int transactions;

    @JsonProperty("balance_matched")
    boolean balanceMatched;

    public static SnapshotImportResponse from(SnapshotImport result) {
        return SnapshotImportResponse.builder()
            .account(AccountResponse.from(result.getAccount()))
            .templates(result.getTemplates())
            .transactions(result.getTransactions())
            .balanceMatched(result.isBalanceMatched())
            .build();
    }
}
