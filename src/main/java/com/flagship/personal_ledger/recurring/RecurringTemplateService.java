package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.account.AccountRepository;
import com.flagship.personal_ledger.category.Category;
import com.flagship.personal_ledger.category.CategoryRepository;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Standalone recurring templates. Recurring transfers are created through the
 * pairing manager.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringTemplateService {

    private final RecurringTemplateRepository templateRepository;
    private final AccountRepository accountRepository;
    private final CategoryRepository categoryRepository;

    /**
     * @throws LedgerException not_found for a foreign account or category,
     *         invalid_request when the category flow differs, invalid_schedule
     */
    @Transactional
    public RecurringTemplate createTemplate(UUID ownerId, RecurringTemplateCommand command) {
        if (command.getAmount() == null || command.getAmount().signum() <= 0) {
            throw LedgerException.invalidRequest("Amount must be greater than 0");
        }
        accountRepository.findActiveOwned(ownerId, command.getAccountId())
            .orElseThrow(() -> LedgerException.notFound("Account", command.getAccountId()));
        Category category = categoryRepository.findVisible(ownerId, command.getCategoryId())
            .orElseThrow(() -> LedgerException.notFound("Category", command.getCategoryId()));
        if (category.getFlowType() != command.getFlowType()) {
            throw LedgerException.invalidRequest("Category " + category.getId() + " is " + category.getFlowType()
                + " but the template is " + command.getFlowType());
        }

        RecurrenceRule rule = new RecurrenceRule(command.getFrequency(), command.getInterval(),
            command.getByWeekday(), command.getByMonthday(), command.getStartDate());
        rule.validate();
        LocalDate endDate = command.getEndDate();
        if (endDate != null && endDate.isBefore(command.getStartDate())) {
            throw new LedgerException(LedgerErrorCode.INVALID_SCHEDULE,
                "Invalid schedule: end date " + endDate + " is before start date " + command.getStartDate());
        }
        LocalDate firstRun = rule.nextOnOrAfter(command.getStartDate());
        if (endDate != null && firstRun.isAfter(endDate)) {
            throw new LedgerException(LedgerErrorCode.INVALID_SCHEDULE,
                "Invalid schedule: no occurrence between " + command.getStartDate() + " and " + endDate);
        }

        UUID id = templateRepository.insert(NewTemplate.builder()
            .ownerId(ownerId)
            .accountId(command.getAccountId())
            .categoryId(category.getId())
            .flowType(command.getFlowType())
            .amount(command.getAmount())
            .description(command.getDescription())
            .frequency(rule.getFrequency())
            .interval(rule.getInterval())
            .byWeekday(rule.getByWeekday())
            .byMonthday(rule.getByMonthday())
            .startDate(rule.getStartDate())
            .firstRunDate(firstRun)
            .endDate(endDate)
            .build());

        log.info("Recurring template created: templateId={}, frequency={}, interval={}, firstRun={}",
            id, rule.getFrequency(), rule.getInterval(), firstRun);
        return getTemplate(ownerId, id);
    }

    @Transactional(readOnly = true)
    public RecurringTemplate getTemplate(UUID ownerId, UUID templateId) {
        return templateRepository.findOwned(ownerId, templateId)
            .orElseThrow(() -> LedgerException.notFound("RecurringTemplate", templateId));
    }
}
