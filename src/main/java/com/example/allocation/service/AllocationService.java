package com.example.allocation.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.allocation.domain.*;
import com.example.allocation.repository.AllocationGroupRepository;
import com.example.allocation.repository.ContactRepository;
import com.example.allocation.service.AllocationProposal.ProposedLine;
import com.example.allocation.service.ValidationResult.Violation;
import com.example.allocation.service.exception.ConcurrentAllocationException;
import com.example.allocation.service.exception.InvalidStateException;
import com.example.allocation.service.exception.ResourceNotFoundException;

/**
 * Entry point for allocating one lump-sum payment across several invoices or bills, and for
 * reversing such an allocation.
 *
 * <p>Creating an allocation runs as a single transaction: validation, document locks, the one
 * aggregate voucher, one settlement per line and the group itself are all committed together or
 * not at all. Document locks are always taken in ascending id order.
 */
@Service
@Transactional
public class AllocationService {

  private static final Logger log = LoggerFactory.getLogger(AllocationService.class);

  private final AllocationGroupRepository groupRepository;
  private final ContactRepository contactRepository;
  private final AccountService accountService;
  private final DocumentBalanceService documentBalanceService;
  private final PaymentAllocator paymentAllocator;
  private final AllocationValidator validator;
  private final CounterAccountResolver counterAccountResolver;
  private final VoucherPostingService voucherPostingService;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public AllocationService(
      AllocationGroupRepository groupRepository,
      ContactRepository contactRepository,
      AccountService accountService,
      DocumentBalanceService documentBalanceService,
      PaymentAllocator paymentAllocator,
      AllocationValidator validator,
      CounterAccountResolver counterAccountResolver,
      VoucherPostingService voucherPostingService,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.groupRepository = groupRepository;
    this.contactRepository = contactRepository;
    this.accountService = accountService;
    this.documentBalanceService = documentBalanceService;
    this.paymentAllocator = paymentAllocator;
    this.validator = validator;
    this.counterAccountResolver = counterAccountResolver;
    this.voucherPostingService = voucherPostingService;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Proposes how a payment would be spread over the counterparty's outstanding documents. Nothing
   * is written.
   */
  @Transactional(readOnly = true)
  public AllocationProposal proposeAllocation(
      AllocationStrategy strategy,
      Long counterpartyId,
      AllocationDirection direction,
      BigDecimal totalAmount) {
    Contact contact = getContact(counterpartyId);
    requireDirection(direction);
    List<Document> outstanding = documentBalanceService.listOutstanding(contact, direction);
    return paymentAllocator.allocate(
        strategy, documentBalanceService.toOutstanding(outstanding), totalAmount);
  }

  /**
   * Validates and posts an allocation.
   *
   * @return the POSTED group with its records
   * @throws com.example.allocation.service.exception.LedgerValidationException if any rule fails
   * @throws InvalidStateException if a line references another counterparty's document
   * @throws ConcurrentAllocationException if a document was settled by someone else before its
   *     lock was obtained
   * @throws com.example.allocation.service.exception.FatalConfigurationException if no usable
   *     counter-account is configured
   */
  public AllocationGroup createAllocation(AllocationRequest request) {
    requireDirection(request.direction());
    if (request.strategy() == null) {
      throw new IllegalArgumentException("Allocation strategy is required");
    }
    if (request.counterpartyId() == null) {
      ValidationResult.of(
              Violation.of(
                  ValidationRule.MISSING_COUNTERPARTY,
                  ValidationRule.MISSING_COUNTERPARTY.getDescription()))
          .throwIfInvalid();
    }

    Contact contact = getContact(request.counterpartyId());
    Company company = contact.getCompany();
    Account cashAccount = null;
    if (request.cashAccountId() != null) {
      cashAccount = accountService.getAccount(request.cashAccountId());
      if (!Objects.equals(cashAccount.getCompany().getId(), company.getId())) {
        throw new ResourceNotFoundException("Account", request.cashAccountId());
      }
    }

    AllocationGroup group =
        new AllocationGroup(
            company,
            request.direction(),
            request.strategy(),
            request.totalAmount(),
            contact,
            cashAccount,
            request.paymentDate());
    group.setCurrency(request.currency() != null ? request.currency() : company.getCurrency());
    if (request.exchangeRate() != null) {
      group.setExchangeRate(request.exchangeRate());
    }
    group.setReference(request.reference());
    group.setNotes(request.notes());
    group.setCounterAccount(counterAccountResolver.resolve(company, request.direction()));

    for (AllocationRecord record : buildRecords(request, contact)) {
      group.addRecord(record);
    }

    validator.validate(group, group.getRecords()).throwIfInvalid();
    lockAndRecheck(group.getRecords());

    group = groupRepository.save(group);
    Voucher voucher = voucherPostingService.postAllocation(group);

    for (AllocationRecord record : group.getRecords()) {
      documentBalanceService.recordSettlement(
          record.getDocument(), record.getAmount(), group.getPaymentDate(), record);
    }

    group.markPosted(voucher, validator.getRoundingTolerance());
    group = groupRepository.save(group);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("strategy", group.getStrategy().name());
    details.put("totalAmount", group.getTotalAmount());
    details.put("voucher", voucher.getVoucherNumber());
    details.put("documents", documentNumbers(group));
    auditService.logEvent(
        company,
        "ALLOCATION_POSTED",
        "AllocationGroup",
        group.getId(),
        group.getDirection()
            + " of "
            + group.getTotalAmount()
            + " allocated across "
            + group.getRecords().size()
            + " document(s) for "
            + contact.getName(),
        details);
    eventPublisher.publishEvent(AllocationStatusChangedEvent.of(group));

    log.info(
        "Posted allocation {} ({} {} for {}) with voucher {}",
        group.getId(),
        group.getDirection(),
        group.getTotalAmount(),
        contact.getName(),
        voucher.getVoucherNumber());
    return group;
  }

  /**
   * Reverses a posted allocation: voids every settlement it created, reverses its voucher and
   * marks it REVERSED. A second call on the same group is rejected.
   *
   * @throws ResourceNotFoundException if the group does not exist
   * @throws InvalidStateException if the group is not POSTED
   */
  public AllocationGroup reverseAllocation(Long groupId) {
    AllocationGroup group =
        groupRepository
            .findByIdForUpdate(groupId)
            .orElseThrow(() -> new ResourceNotFoundException("AllocationGroup", groupId));
    if (group.isReversed()) {
      throw new InvalidStateException("Allocation " + groupId + " is already reversed");
    }
    if (!group.isPosted()) {
      throw new InvalidStateException(
          "Allocation " + groupId + " cannot be reversed from status " + group.getStatus());
    }

    List<AllocationRecord> records = new ArrayList<>(group.getRecords());
    records.sort(Comparator.comparing(r -> r.getDocument().getId()));
    int voided = 0;
    for (AllocationRecord record : records) {
      documentBalanceService.lockDocument(record.getDocument().getId());
      DocumentSettlement settlement = record.getSettlement();
      if (settlement != null && !settlement.isVoided()) {
        documentBalanceService.voidSettlement(settlement);
        voided++;
      }
    }

    Voucher compensation =
        voucherPostingService.reverse(group.getVoucher(), "Allocation " + groupId + " reversed");
    group.markReversed();
    group = groupRepository.save(group);

    auditService.logEvent(
        group.getCompany(),
        "ALLOCATION_REVERSED",
        "AllocationGroup",
        group.getId(),
        "Reversed allocation of "
            + group.getTotalAmount()
            + " for "
            + group.getContact().getName(),
        Map.of(
            "voidedSettlements", voided,
            "reversalVoucher", compensation.getVoucherNumber()));
    eventPublisher.publishEvent(AllocationStatusChangedEvent.of(group));

    log.info(
        "Reversed allocation {} ({} settlements voided, reversal voucher {})",
        groupId,
        voided,
        compensation.getVoucherNumber());
    return group;
  }

  @Transactional(readOnly = true)
  public AllocationGroup getAllocation(Long groupId) {
    return groupRepository
        .findWithRecordsById(groupId)
        .orElseThrow(() -> new ResourceNotFoundException("AllocationGroup", groupId));
  }

  /** Allocations for a counterparty, newest first. */
  @Transactional(readOnly = true)
  public List<AllocationGroup> listAllocations(Long counterpartyId) {
    return groupRepository.findByContactOrderByCreatedAtDesc(getContact(counterpartyId));
  }

  @Transactional(readOnly = true)
  public List<Document> listOutstandingDocuments(
      Long counterpartyId, AllocationDirection direction) {
    requireDirection(direction);
    return documentBalanceService.listOutstanding(getContact(counterpartyId), direction);
  }

  private List<AllocationRecord> buildRecords(AllocationRequest request, Contact contact) {
    List<AllocationRecord> records = new ArrayList<>();

    if (request.lines().isEmpty()
        && request.strategy() != AllocationStrategy.MANUAL
        && request.totalAmount() != null
        && request.totalAmount().signum() > 0) {
      List<Document> outstanding =
          documentBalanceService.listOutstanding(contact, request.direction());
      AllocationProposal proposal =
          paymentAllocator.allocate(
              request.strategy(),
              documentBalanceService.toOutstanding(outstanding),
              request.totalAmount());
      for (ProposedLine line : proposal.lines()) {
        records.add(
            new AllocationRecord(
                documentBalanceService.getDocument(line.documentId()), line.amount(), null));
      }
      return records;
    }

    for (int i = 0; i < request.lines().size(); i++) {
      AllocationRequest.Line line = request.lines().get(i);
      if (line.documentId() == null) {
        ValidationResult.of(
                Violation.forLine(
                    ValidationRule.DOCUMENT_REFERENCE,
                    i,
                    null,
                    "Line " + (i + 1) + ": " + ValidationRule.DOCUMENT_REFERENCE.getDescription()))
            .throwIfInvalid();
      }
      records.add(
          new AllocationRecord(
              documentBalanceService.getDocument(line.documentId()), line.amount(), line.note()));
    }
    return records;
  }

  /**
   * Locks every allocated document in ascending id order and checks that the amount due is still
   * enough now that no one else can settle it.
   */
  private void lockAndRecheck(List<AllocationRecord> records) {
    List<AllocationRecord> sorted = new ArrayList<>(records);
    sorted.sort(Comparator.comparing(r -> r.getDocument().getId()));
    for (AllocationRecord record : sorted) {
      Document locked = documentBalanceService.lockDocument(record.getDocument().getId());
      BigDecimal due = documentBalanceService.amountDue(locked);
      if (record.getAmount().compareTo(due) > 0) {
        throw new ConcurrentAllocationException(
            locked.getId(),
            locked.getDisplayName()
                + " now has only "
                + due
                + " due, "
                + record.getAmount()
                + " was requested; refresh outstanding documents and retry");
      }
    }
  }

  private Contact getContact(Long counterpartyId) {
    if (counterpartyId == null) {
      throw new ResourceNotFoundException("Contact", null);
    }
    return contactRepository
        .findById(counterpartyId)
        .orElseThrow(() -> new ResourceNotFoundException("Contact", counterpartyId));
  }

  private static void requireDirection(AllocationDirection direction) {
    if (direction == null) {
      throw new IllegalArgumentException("Allocation direction is required");
    }
  }

  private static List<String> documentNumbers(AllocationGroup group) {
    List<String> numbers = new ArrayList<>();
    for (AllocationRecord record : group.getRecords()) {
      numbers.add(record.getDocument().getDocumentNumber());
    }
    return numbers;
  }
}
