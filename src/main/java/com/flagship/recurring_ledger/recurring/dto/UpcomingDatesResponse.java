package com.flagship.recurring_ledger.recurring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class UpcomingDatesResponse {

    @JsonProperty("template_id")
    UUID templateId;

    @JsonProperty("dates")
    List<LocalDate> dates;
}
