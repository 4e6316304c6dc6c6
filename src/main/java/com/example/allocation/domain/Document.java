package com.example.allocation.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A financial document that can be settled by cash: a sales invoice (money owed to us) or a
 * supplier bill (money we owe).
 *
 * <p>The settled amount is a cache of the sum of the document's live settlements. It is only ever
 * written through {@link #applySettledAmount(BigDecimal)}, which also derives the status, so that
 * {@code amountDue = total - amountSettled >= 0} holds whenever the document is persisted.
 */
@Entity
@Table(
    name = "document",
    uniqueConstraints = {
      @UniqueConstraint(columnNames = {"company_id", "document_kind", "document_number"})
    },
    indexes = {@Index(name = "idx_document_contact_due", columnList = "contact_id, due_date")})
@Inheritance(strategy = InheritanceType.SINGLE_TABLE)
@DiscriminatorColumn(name = "document_kind", length = 10)
public abstract class Document {

  public enum SettlementStatus {
    OPEN, // Nothing settled yet
    PARTIALLY_SETTLED, // Something settled, something still due
    SETTLED // Nothing left due
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "contact_id", nullable = false)
  private Contact contact;

  @NotBlank
  @Size(max = 20)
  @Column(name = "document_number", nullable = false, length = 20)
  private String documentNumber;

  @Column(name = "issue_date")
  private LocalDate issueDate;

  @NotNull
  @Column(name = "due_date", nullable = false)
  private LocalDate dueDate;

  @Size(max = 3)
  @Column(length = 3)
  private String currency;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal total = BigDecimal.ZERO;

  @NotNull
  @Column(name = "amount_settled", nullable = false, precision = 19, scale = 2)
  private BigDecimal amountSettled = BigDecimal.ZERO;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private SettlementStatus status = SettlementStatus.OPEN;

  @Size(max = 255)
  @Column(length = 255)
  private String reference;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
    updatedAt = Instant.now();
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  // Constructors
  protected Document() {}

  protected Document(
      Company company, Contact contact, String documentNumber, LocalDate dueDate, BigDecimal total) {
    this.company = company;
    this.contact = contact;
    this.documentNumber = documentNumber;
    this.dueDate = dueDate;
    this.total = total;
  }

  /** The direction of cash movement that settles this kind of document. */
  public abstract AllocationDirection getSettlingDirection();

  /** Short label used in descriptions and audit messages, e.g. "Invoice INV-1". */
  public abstract String getDisplayName();

  public BigDecimal getAmountDue() {
    return total.subtract(amountSettled);
  }

  /**
   * Records the current sum of live settlements and derives the status from it.
   *
   * @throws IllegalStateException if the settled amount is negative or exceeds the total
   */
  public void applySettledAmount(BigDecimal settled) {
    if (settled.signum() < 0) {
      throw new IllegalStateException(
          getDisplayName() + " cannot have a negative settled amount: " + settled);
    }
    if (settled.compareTo(total) > 0) {
      throw new IllegalStateException(
          getDisplayName() + " would be over-settled: settled=" + settled + ", total=" + total);
    }
    this.amountSettled = settled;
    this.status = statusFor(total, settled);
  }

  public static SettlementStatus statusFor(BigDecimal total, BigDecimal settled) {
    if (settled.signum() == 0) {
      return SettlementStatus.OPEN;
    }
    if (total.subtract(settled).signum() == 0) {
      return SettlementStatus.SETTLED;
    }
    return SettlementStatus.PARTIALLY_SETTLED;
  }

  public boolean isSettled() {
    return status == SettlementStatus.SETTLED;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Company getCompany() {
    return company;
  }

  public void setCompany(Company company) {
    this.company = company;
  }

  public Contact getContact() {
    return contact;
  }

  public void setContact(Contact contact) {
    this.contact = contact;
  }

  public String getDocumentNumber() {
    return documentNumber;
  }

  public void setDocumentNumber(String documentNumber) {
    this.documentNumber = documentNumber;
  }

  public LocalDate getIssueDate() {
    return issueDate;
  }

  public void setIssueDate(LocalDate issueDate) {
    this.issueDate = issueDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public void setDueDate(LocalDate dueDate) {
    this.dueDate = dueDate;
  }

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public void setTotal(BigDecimal total) {
    this.total = total;
  }

  public BigDecimal getAmountSettled() {
    return amountSettled;
  }

  public SettlementStatus getStatus() {
    return status;
  }

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public Long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
