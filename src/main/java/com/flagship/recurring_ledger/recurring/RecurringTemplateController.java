package com.flagship.recurring_ledger.recurring;

import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import com.flagship.recurring_ledger.recurring.dto.CreateTemplateRequest;
import com.flagship.recurring_ledger.recurring.dto.SyncReportResponse;
import com.flagship.recurring_ledger.recurring.dto.TemplateEditResponse;
import com.flagship.recurring_ledger.recurring.dto.TemplateResponse;
import com.flagship.recurring_ledger.recurring.dto.UpcomingDatesResponse;
import com.flagship.recurring_ledger.recurring.dto.UpdateTemplateRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RecurringTemplateController {

    private final RecurringTemplateService templateService;
    private final RecurringSyncService syncService;

    @PostMapping("/accounts/{accountId}/recurring")
    public ResponseEntity<TemplateResponse> createTemplate(@PathVariable("accountId") UUID accountId,
                                                           @Valid @RequestBody CreateTemplateRequest request) {
        RecurringTemplate template = RecurringTemplate.create(accountId, request.getStartDate(),
            request.getVendor(), request.getCategory(), request.getAmount(), request.getNotes(),
            request.getFrequencyDays(), request.getNextDueDate(), request.getTotalOccurrences());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TemplateResponse.from(templateService.createTemplate(template)));
    }

    @GetMapping("/accounts/{accountId}/recurring")
    public List<TemplateResponse> listTemplates(@PathVariable("accountId") UUID accountId) {
        return templateService.listTemplates(accountId).stream()
            .map(TemplateResponse::from)
            .toList();
    }

    @GetMapping("/recurring/{templateId}")
    public TemplateResponse getTemplate(@PathVariable("templateId") UUID templateId) {
        return TemplateResponse.from(templateService.getTemplate(templateId));
    }

    @PatchMapping("/recurring/{templateId}")
    public TemplateEditResponse editTemplate(@PathVariable("templateId") UUID templateId,
                                             @Valid @RequestBody UpdateTemplateRequest request) {
        return TemplateEditResponse.from(templateService.editTemplate(templateId, request.toEdit()));
    }

    /**
     * Deletes the template. {@code cascade=true} also deletes its generated transactions,
     * otherwise they are kept as manual entries.
     */
    @DeleteMapping("/recurring/{templateId}")
    public ResponseEntity<Void> deleteTemplate(@PathVariable("templateId") UUID templateId,
                                               @RequestParam(name = "cascade", defaultValue = "false") boolean cascade) {
        templateService.deleteTemplate(templateId, cascade);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/recurring/{templateId}/upcoming")
    public UpcomingDatesResponse upcomingDates(
            @PathVariable("templateId") UUID templateId,
            @RequestParam(name = "limit", defaultValue = "" + RecurringTemplateService.DEFAULT_UPCOMING_LIMIT) int limit) {
        return new UpcomingDatesResponse(templateId, templateService.upcomingDates(templateId, limit));
    }

    /**
     * Generates every occurrence due on the user's accounts, as of {@code asOf} or today.
     * Called by the login flow.
     */
    @PostMapping("/users/{userId}/recurring/sync")
    public SyncReportResponse syncUser(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        SyncReport report = asOf != null ? syncService.syncUser(userId, asOf) : syncService.syncUser(userId);
        return SyncReportResponse.from(report);
    }
}
