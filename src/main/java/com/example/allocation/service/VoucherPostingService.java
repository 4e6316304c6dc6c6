package com.example.allocation.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.allocation.domain.*;
import com.example.allocation.repository.AllocationGroupRepository;
import com.example.allocation.repository.CompanyRepository;
import com.example.allocation.repository.LedgerEntryRepository;
import com.example.allocation.repository.ReversalLinkRepository;
import com.example.allocation.repository.VoucherRepository;
import com.example.allocation.service.ValidationResult.Violation;
import com.example.allocation.service.exception.InvalidStateException;
import com.example.allocation.service.exception.ResourceNotFoundException;

/**
 * Service responsible for posting vouchers to the general ledger. Ensures all accounting rules
 * are enforced:
 *
 * <ul>
 *   <li>One debit leg and one credit leg of the same positive amount, on different accounts
 *   <li>Leg classifications allowed by the voucher type
 *   <li>Posted vouchers are immutable; reversal posts a compensating voucher
 * </ul>
 *
 * <p>An allocation group posts exactly one voucher for its whole cash movement, never one per
 * settled document.
 */
@Service
@Transactional
public class VoucherPostingService {

  private static final Logger log = LoggerFactory.getLogger(VoucherPostingService.class);

  private final VoucherRepository voucherRepository;
  private final LedgerEntryRepository ledgerEntryRepository;
  private final ReversalLinkRepository reversalLinkRepository;
  private final AllocationGroupRepository allocationGroupRepository;
  private final CompanyRepository companyRepository;
  private final AccountService accountService;
  private final AuditService auditService;

  public VoucherPostingService(
      VoucherRepository voucherRepository,
      LedgerEntryRepository ledgerEntryRepository,
      ReversalLinkRepository reversalLinkRepository,
      AllocationGroupRepository allocationGroupRepository,
      CompanyRepository companyRepository,
      AccountService accountService,
      AuditService auditService) {
    this.voucherRepository = voucherRepository;
    this.ledgerEntryRepository = ledgerEntryRepository;
    this.reversalLinkRepository = reversalLinkRepository;
    this.allocationGroupRepository = allocationGroupRepository;
    this.companyRepository = companyRepository;
    this.accountService = accountService;
    this.auditService = auditService;
  }

  /**
   * Posts the aggregate cash movement of an allocation. A receipt debits cash and credits the
   * receivable side; a payment debits the payable side and credits cash. The amount is always the
   * group total.
   */
  public Voucher postAllocation(AllocationGroup group) {
    VoucherType type = group.getDirection().voucherType();
    Account debit;
    Account credit;
    if (group.getDirection() == AllocationDirection.RECEIPT) {
      debit = group.getCashAccount();
      credit = group.getCounterAccount();
    } else {
      debit = group.getCounterAccount();
      credit = group.getCashAccount();
    }

    Voucher voucher =
        new Voucher(
            group.getCompany(), type, group.getTotalAmount(), debit, credit, group.getPaymentDate());
    voucher.setDescription(
        (group.getDirection() == AllocationDirection.RECEIPT ? "Receipt from " : "Payment to ")
            + group.getContact().getName()
            + " ("
            + group.getRecords().size()
            + (group.getRecords().size() == 1 ? " document)" : " documents)"));
    voucher.setReference(group.getReference());
    voucher.setBeneficiaryName(group.getContact().getName());

    return post(voucher);
  }

  /**
   * Creates and posts a voucher outside any allocation. The type must already be normalized
   * (see {@link VoucherType#fromInput(String)}). Both accounts must belong to the same tenant; a
   * credit account of another tenant is reported as not found.
   */
  public Voucher createVoucher(VoucherRequest request) {
    if (request.type() == null) {
      throw new IllegalArgumentException("Voucher type is required");
    }
    Account debit = accountService.getAccount(request.debitAccountId());
    Account credit = accountService.getAccount(request.creditAccountId());
    if (!Objects.equals(debit.getCompany().getId(), credit.getCompany().getId())) {
      throw new ResourceNotFoundException("Account", request.creditAccountId());
    }

    Voucher voucher =
        new Voucher(
            debit.getCompany(),
            request.type(),
            request.amount(),
            debit,
            credit,
            request.transactionDate() != null ? request.transactionDate() : LocalDate.now());
    voucher.setDescription(request.description());
    voucher.setReference(request.reference());
    voucher.setBeneficiaryName(request.beneficiaryName());

    return post(voucher);
  }

  /**
   * Posts a pending voucher: numbers it, writes its two ledger entries and marks it posted.
   *
   * @throws com.example.allocation.service.exception.LedgerValidationException if the legs
   *     break the voucher rules
   * @throws InvalidStateException if the voucher is not pending
   */
  public Voucher post(Voucher voucher) {
    if (!voucher.isPending()) {
      throw new InvalidStateException(
          "Voucher " + voucher.getVoucherNumber() + " is already " + voucher.getStatus());
    }
    validate(voucher).throwIfInvalid();

    voucher.setVoucherNumber(nextVoucherNumber(voucher.getCompany(), voucher.getType()));
    voucher = voucherRepository.save(voucher);

    if (ledgerEntryRepository.existsByVoucher(voucher)) {
      throw new IllegalStateException(
          "Ledger entries already exist for voucher " + voucher.getVoucherNumber());
    }
    List<LedgerEntry> entries = new ArrayList<>();
    entries.add(new LedgerEntry(voucher, LedgerEntry.Direction.DEBIT));
    entries.add(new LedgerEntry(voucher, LedgerEntry.Direction.CREDIT));
    ledgerEntryRepository.saveAll(entries);

    voucher.markPosted();
    voucher = voucherRepository.save(voucher);

    auditService.logEvent(
        voucher.getCompany(),
        "VOUCHER_POSTED",
        "Voucher",
        voucher.getId(),
        "Posted " + voucher.getType() + " voucher " + voucher.getVoucherNumber(),
        Map.of(
            "amount", voucher.getAmount(),
            "debitAccount", voucher.getDebitAccount().getCode(),
            "creditAccount", voucher.getCreditAccount().getCode()));
    log.info(
        "Posted voucher {} ({} {})",
        voucher.getVoucherNumber(),
        voucher.getType(),
        voucher.getAmount());

    return voucher;
  }

  /** Checks the voucher against the per-type leg rules without touching storage. */
  public ValidationResult validate(Voucher voucher) {
    List<Violation> violations = new ArrayList<>();
    VoucherType type = voucher.getType();
    Account debit = voucher.getDebitAccount();
    Account credit = voucher.getCreditAccount();

    if (voucher.getAmount() == null || voucher.getAmount().signum() <= 0) {
      violations.add(
          Violation.of(
              ValidationRule.VOUCHER_AMOUNT,
              "Voucher amount must be positive but was " + voucher.getAmount()));
    } else if (AllocationValidator.exceedsMinorUnit(voucher.getAmount())) {
      violations.add(
          Violation.of(
              ValidationRule.AMOUNT_PRECISION,
              "Voucher amount " + voucher.getAmount() + " has more than two decimal places"));
    }
    if (debit == null || credit == null) {
      violations.add(
          Violation.of(
              ValidationRule.MISSING_ACCOUNT, ValidationRule.MISSING_ACCOUNT.getDescription()));
      return ValidationResult.of(violations);
    }
    if (sameAccount(debit, credit)) {
      violations.add(
          Violation.of(
              ValidationRule.SAME_ACCOUNT,
              "Debit and credit account are both " + debit.getCode()));
    }
    if (!type.permitsDebit(debit.getType())) {
      violations.add(
          Violation.of(
              ValidationRule.DEBIT_ACCOUNT_CLASS,
              type
                  + " voucher cannot debit "
                  + debit.getType()
                  + " account "
                  + debit.getCode()
                  + " (allowed: "
                  + type.getDebitTypes()
                  + ")"));
    }
    if (!type.permitsCredit(credit.getType())) {
      violations.add(
          Violation.of(
              ValidationRule.CREDIT_ACCOUNT_CLASS,
              type
                  + " voucher cannot credit "
                  + credit.getType()
                  + " account "
                  + credit.getCode()
                  + " (allowed: "
                  + type.getCreditTypes()
                  + ")"));
    }
    for (Account account : List.of(debit, credit)) {
      if (!account.isActive()) {
        violations.add(
            Violation.of(
                ValidationRule.INACTIVE_ACCOUNT, "Account " + account.getCode() + " is inactive"));
      }
    }
    return ValidationResult.of(violations);
  }

  /**
   * Reverses a posted voucher. The original keeps its legs and amount and becomes REVERSED; a
   * JOURNAL voucher with the legs swapped is posted to cancel its ledger effect, and the two are
   * linked.
   *
   * @return the compensating voucher
   */
  public Voucher reverse(Voucher original, String reason) {
    if (!original.isPosted()) {
      throw new InvalidStateException(
          "Only posted vouchers can be reversed; "
              + original.getVoucherNumber()
              + " is "
              + original.getStatus());
    }

    Voucher compensation =
        new Voucher(
            original.getCompany(),
            VoucherType.JOURNAL,
            original.getAmount(),
            original.getCreditAccount(),
            original.getDebitAccount(),
            original.getTransactionDate());
    compensation.setDescription(
        "Reversal of "
            + original.getVoucherNumber()
            + (reason != null && !reason.isBlank() ? " - " + reason : ""));
    compensation.setReference("REV-" + original.getVoucherNumber());
    compensation = post(compensation);

    original.markReversed();
    voucherRepository.save(original);
    reversalLinkRepository.save(new ReversalLink(original, compensation, reason));

    auditService.logEvent(
        original.getCompany(),
        "VOUCHER_REVERSED",
        "Voucher",
        original.getId(),
        "Reversed voucher "
            + original.getVoucherNumber()
            + " with "
            + compensation.getVoucherNumber());
    log.info(
        "Reversed voucher {} with {}",
        original.getVoucherNumber(),
        compensation.getVoucherNumber());

    return compensation;
  }

  /**
   * Reverses a standalone voucher. Vouchers owned by an allocation go through the allocation's
   * reversal so the settlements are voided with them.
   */
  public Voucher reverseVoucher(Long voucherId, String reason) {
    Voucher voucher = getVoucher(voucherId);
    if (allocationGroupRepository.existsByVoucher(voucher)) {
      throw new InvalidStateException(
          "Voucher "
              + voucher.getVoucherNumber()
              + " belongs to an allocation; reverse the allocation instead");
    }
    if (reversalLinkRepository.existsByReversingVoucher(voucher)) {
      throw new InvalidStateException(
          "Voucher " + voucher.getVoucherNumber() + " is itself a reversal");
    }
    return reverse(voucher, reason);
  }

  @Transactional(readOnly = true)
  public Voucher getVoucher(Long voucherId) {
    return voucherRepository
        .findById(voucherId)
        .orElseThrow(() -> new ResourceNotFoundException("Voucher", voucherId));
  }

  @Transactional(readOnly = true)
  public List<Voucher> listVouchers(
      Company company,
      VoucherType type,
      Voucher.Status status,
      LocalDate fromDate,
      LocalDate toDate) {
    return voucherRepository.search(company, type, status, fromDate, toDate);
  }

  /**
   * Numbers are per tenant and type. The tenant row stays locked until commit so that concurrent
   * postings count each other's vouchers instead of taking the same number.
   */
  private String nextVoucherNumber(Company company, VoucherType type) {
    companyRepository
        .findByIdForUpdate(company.getId())
        .orElseThrow(() -> new ResourceNotFoundException("Company", company.getId()));
    long sequence = voucherRepository.countByCompanyAndType(company, type) + 1;
    return String.format("%s-%05d", type.getNumberPrefix(), sequence);
  }

  private static boolean sameAccount(Account debit, Account credit) {
    if (debit == credit) {
      return true;
    }
    return debit.getId() != null && debit.getId().equals(credit.getId());
  }

  /** Input for a voucher created outside an allocation. */
  public record VoucherRequest(
      VoucherType type,
      LocalDate transactionDate,
      BigDecimal amount,
      Long debitAccountId,
      Long creditAccountId,
      String description,
      String reference,
      String beneficiaryName) {}
}
