package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.recurring.dto.CreateTemplateRequest;
import com.flagship.personal_ledger.recurring.dto.SyncResponse;
import com.flagship.personal_ledger.recurring.dto.TemplateResponse;
import com.flagship.personal_ledger.security.OwnerContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Template lifecycle and on-demand sync. Deletion lives with the other
 * deletions in the deletion controller.
 */
@RestController
@RequiredArgsConstructor
public class RecurringTemplateController {

    private final RecurringTemplateService templateService;
    private final RecurringSyncService syncService;
    private final Clock clock;

    @PostMapping("/api/recurring-templates")
    public ResponseEntity<TemplateResponse> createTemplate(@Valid @RequestBody CreateTemplateRequest request) {
        RecurringTemplate template = templateService.createTemplate(OwnerContext.requireOwnerId(), request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(TemplateResponse.from(template));
    }

    @GetMapping("/api/recurring-templates/{id}")
    public ResponseEntity<TemplateResponse> getTemplate(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TemplateResponse.from(templateService.getTemplate(OwnerContext.requireOwnerId(), id)));
    }

    @PostMapping("/api/recurring-templates/{id}/pause")
    public ResponseEntity<TemplateResponse> pause(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TemplateResponse.from(syncService.pause(OwnerContext.requireOwnerId(), id)));
    }

    @PostMapping("/api/recurring-templates/{id}/resume")
    public ResponseEntity<TemplateResponse> resume(@PathVariable("id") UUID id) {
        RecurringTemplate template = syncService.resume(OwnerContext.requireOwnerId(), id, LocalDate.now(clock));
        return ResponseEntity.ok(TemplateResponse.from(template));
    }

    /**
     * Materializes everything due up to {@code as_of} (today by default).
     */
    @PostMapping("/api/recurring/sync")
    public ResponseEntity<SyncResponse> sync(
            @RequestParam(value = "as_of", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        LocalDate effective = asOf != null ? asOf : LocalDate.now(clock);
        return ResponseEntity.ok(SyncResponse.from(syncService.sync(OwnerContext.requireOwnerId(), effective)));
    }
}
