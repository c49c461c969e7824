package com.flagship.recurring_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.account.BalanceAudit;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class BalanceAuditResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("previous_balance")
    BigDecimal previousBalance;

    @JsonProperty("recalculated_balance")
    BigDecimal recalculatedBalance;

    @JsonProperty("drift")
    BigDecimal drift;

    @JsonProperty("drift_detected")
    boolean driftDetected;

    public static BalanceAuditResponse from(BalanceAudit audit) {
        return BalanceAuditResponse.builder()
            .accountId(audit.getAccountId())
            .previousBalance(audit.getPreviousBalance())
            .recalculatedBalance(audit.getRecalculatedBalance())
            .drift(audit.getDrift())
            .driftDetected(audit.isDriftDetected())
            .build();
    }
}
