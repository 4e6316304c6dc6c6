package com.example.allocation.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.example.allocation.domain.Account;
import com.example.allocation.domain.AllocationGroup;
import com.example.allocation.domain.AllocationRecord;
import com.example.allocation.domain.Contact;
import com.example.allocation.domain.Document;
import com.example.allocation.service.ValidationResult.Violation;
import com.example.allocation.service.exception.FatalConfigurationException;

/**
 * Checks a draft allocation before anything is persisted. All correctable problems are collected
 * into one {@link ValidationResult}; a missing or misclassified counter-account is a setup error
 * and is thrown as {@link FatalConfigurationException} instead.
 *
 * <p>Amounts due are read from storage here rather than trusted from the proposal step.
 */
@Component
public class AllocationValidator {

  /** Decimal places stored for every money column. */
  static final int MONEY_SCALE = 2;

  private final DocumentBalanceService documentBalanceService;

  @Value("${ledger.allocation.rounding-tolerance:0.01}")
  private BigDecimal roundingTolerance = new BigDecimal("0.01");

  public AllocationValidator(DocumentBalanceService documentBalanceService) {
    this.documentBalanceService = documentBalanceService;
  }

  public ValidationResult validate(AllocationGroup group, List<AllocationRecord> records) {
    List<Violation> violations = new ArrayList<>();

    // 1. At least one line
    if (records == null || records.isEmpty()) {
      violations.add(Violation.of(ValidationRule.NO_LINES, ValidationRule.NO_LINES.getDescription()));
      records = List.of();
    }

    Contact counterparty = group.getContact();
    Set<Long> seenDocuments = new HashSet<>();

    for (int i = 0; i < records.size(); i++) {
      AllocationRecord record = records.get(i);
      Document document = record.getDocument();
      Long documentId = document.getId();

      // 2. Strictly positive amounts
      if (record.getAmount() == null || record.getAmount().signum() <= 0) {
        violations.add(
            Violation.forLine(
                ValidationRule.NON_POSITIVE_AMOUNT,
                i,
                documentId,
                "Line " + (i + 1) + ": amount must be positive but was " + record.getAmount()));
      } else if (exceedsMinorUnit(record.getAmount())) {
        violations.add(
            Violation.forLine(
                ValidationRule.AMOUNT_PRECISION,
                i,
                documentId,
                "Line "
                    + (i + 1)
                    + ": amount "
                    + record.getAmount()
                    + " has more than "
                    + MONEY_SCALE
                    + " decimal places"));
      }

      // 3. One document per line, same counterparty, matching direction and currency
      if (!seenDocuments.add(documentId)) {
        violations.add(
            Violation.forLine(
                ValidationRule.DUPLICATE_DOCUMENT,
                i,
                documentId,
                "Line " + (i + 1) + ": " + document.getDisplayName() + " appears more than once"));
      }
      if (counterparty != null
          && !Objects.equals(document.getContact().getId(), counterparty.getId())) {
        violations.add(
            Violation.forLine(
                ValidationRule.COUNTERPARTY_MISMATCH,
                i,
                documentId,
                "Line "
                    + (i + 1)
                    + ": "
                    + document.getDisplayName()
                    + " does not belong to "
                    + counterparty.getName()));
      }
      if (document.getSettlingDirection() != group.getDirection()) {
        violations.add(
            Violation.forLine(
                ValidationRule.DOCUMENT_DIRECTION,
                i,
                documentId,
                "Line "
                    + (i + 1)
                    + ": "
                    + document.getDisplayName()
                    + " cannot be settled by a "
                    + group.getDirection()));
      }
      if (group.getCurrency() != null
          && document.getCurrency() != null
          && !group.getCurrency().equalsIgnoreCase(document.getCurrency())) {
        violations.add(
            Violation.forLine(
                ValidationRule.CURRENCY_MISMATCH,
                i,
                documentId,
                "Line "
                    + (i + 1)
                    + ": "
                    + document.getDisplayName()
                    + " is in "
                    + document.getCurrency()
                    + ", allocation is in "
                    + group.getCurrency()));
      }
    }

    // 4. Lines add up to the total within tolerance
    BigDecimal total = group.getTotalAmount();
    if (total == null || total.signum() <= 0) {
      violations.add(
          Violation.of(
              ValidationRule.TOTAL_NOT_POSITIVE, "Total amount must be positive but was " + total));
    } else if (exceedsMinorUnit(total)) {
      violations.add(
          Violation.of(
              ValidationRule.AMOUNT_PRECISION,
              "Total amount " + total + " has more than " + MONEY_SCALE + " decimal places"));
    } else if (!records.isEmpty()) {
      BigDecimal allocated = group.sumRecordAmounts();
      if (allocated.subtract(total).abs().compareTo(roundingTolerance) > 0) {
        violations.add(
            Violation.of(
                ValidationRule.UNBALANCED,
                "Allocated amounts total " + allocated + " but the payment is " + total));
      }
    }

    // 5. No line exceeds what its document still owes, read fresh
    for (int i = 0; i < records.size(); i++) {
      AllocationRecord record = records.get(i);
      if (record.getAmount() == null || record.getAmount().signum() <= 0) {
        continue;
      }
      Document document = record.getDocument();
      BigDecimal due = documentBalanceService.amountDue(document);
      if (record.getAmount().compareTo(due) > 0) {
        violations.add(
            Violation.forLine(
                ValidationRule.EXCEEDS_AMOUNT_DUE,
                i,
                document.getId(),
                "Line "
                    + (i + 1)
                    + ": "
                    + record.getAmount()
                    + " exceeds the amount due on "
                    + document.getDisplayName()
                    + " ("
                    + due
                    + ")"));
      }
    }

    // Party and header checks
    if (counterparty == null) {
      violations.add(
          Violation.of(
              ValidationRule.MISSING_COUNTERPARTY,
              ValidationRule.MISSING_COUNTERPARTY.getDescription()));
    } else if (!counterparty.canTransact(group.getDirection())) {
      violations.add(
          Violation.of(
              ValidationRule.COUNTERPARTY_ROLE,
              counterparty.getName() + " cannot take part in a " + group.getDirection()));
    }
    if (group.getPaymentDate() == null) {
      violations.add(
          Violation.of(
              ValidationRule.MISSING_PAYMENT_DATE,
              ValidationRule.MISSING_PAYMENT_DATE.getDescription()));
    }
    if (group.getExchangeRate() != null && group.getExchangeRate().signum() <= 0) {
      violations.add(
          Violation.of(
              ValidationRule.EXCHANGE_RATE,
              "Exchange rate must be positive but was " + group.getExchangeRate()));
    }

    // 6. Cash leg is an asset
    Account cashAccount = group.getCashAccount();
    if (cashAccount == null) {
      violations.add(
          Violation.of(
              ValidationRule.MISSING_CASH_ACCOUNT,
              ValidationRule.MISSING_CASH_ACCOUNT.getDescription()));
    } else if (cashAccount.getType() != Account.AccountType.ASSET) {
      violations.add(
          Violation.of(
              ValidationRule.CASH_ACCOUNT_CLASS,
              "Account "
                  + cashAccount.getCode()
                  + " is a "
                  + cashAccount.getType()
                  + " account, not an asset"));
    } else if (!cashAccount.isActive()) {
      violations.add(
          Violation.of(
              ValidationRule.INACTIVE_ACCOUNT, "Account " + cashAccount.getCode() + " is inactive"));
    }

    // 7. Counter-account must suit the direction; a setup error otherwise
    Account counterAccount = group.getCounterAccount();
    if (counterAccount == null) {
      throw new FatalConfigurationException(
          "No counter-account resolved for " + group.getDirection());
    }
    if (!CounterAccountResolver.isUsable(counterAccount, group.getDirection())) {
      throw new FatalConfigurationException(
          "Counter-account "
              + counterAccount.getCode()
              + " cannot be used for a "
              + group.getDirection());
    }

    return ValidationResult.of(violations);
  }

  /** Whether the amount would lose digits when stored at {@link #MONEY_SCALE} places. */
  static boolean exceedsMinorUnit(BigDecimal amount) {
    return amount.stripTrailingZeros().scale() > MONEY_SCALE;
  }

  public BigDecimal getRoundingTolerance() {
    return roundingTolerance;
  }
}
