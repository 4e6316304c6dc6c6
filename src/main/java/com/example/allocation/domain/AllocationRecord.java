package com.example.allocation.domain;

import java.math.BigDecimal;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One line of an allocation group: the share of the lump sum applied to exactly one document.
 * Amount and document are fixed at creation; only the link to the settlement it produced is set
 * afterwards.
 */
@Entity
@Table(
    name = "allocation_record",
    indexes = {@Index(name = "idx_allocation_record_document", columnList = "document_id")})
public class AllocationRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "group_id", nullable = false)
  private AllocationGroup group;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false)
  private Document document;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @Size(max = 255)
  @Column(length = 255)
  private String note;

  @OneToOne(mappedBy = "allocationRecord", fetch = FetchType.LAZY)
  private DocumentSettlement settlement;

  // Constructors
  protected AllocationRecord() {}

  public AllocationRecord(Document document, BigDecimal amount, String note) {
    if (document == null) {
      throw new IllegalArgumentException("Allocation record must reference exactly one document");
    }
    this.document = document;
    this.amount = amount;
    this.note = note;
  }

  // Getters; amount and document are immutable
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public AllocationGroup getGroup() {
    return group;
  }

  void setGroup(AllocationGroup group) {
    this.group = group;
  }

  public Document getDocument() {
    return document;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getNote() {
    return note;
  }

  public DocumentSettlement getSettlement() {
    return settlement;
  }

  /** Links the settlement this record produced, in both directions. */
  public void linkSettlement(DocumentSettlement settlement) {
    this.settlement = settlement;
    settlement.setAllocationRecord(this);
  }
}
