package com.example.allocation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** A counterparty: a customer we invoice, a supplier who bills us, or both. */
@Entity
@Table(
    name = "contact",
    uniqueConstraints = {@UniqueConstraint(columnNames = {"company_id", "code"})})
public class Contact {

  public enum ContactType {
    CUSTOMER,
    SUPPLIER,
    BOTH
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotBlank
  @Size(max = 20)
  @Column(nullable = false, length = 20)
  private String code;

  @NotBlank
  @Size(max = 100)
  @Column(nullable = false, length = 100)
  private String name;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private ContactType type = ContactType.CUSTOMER;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public Contact() {}

  public Contact(Company company, String code, String name, ContactType type) {
    this.company = company;
    this.code = code;
    this.name = name;
    this.type = type;
  }

  public boolean isCustomer() {
    return type == ContactType.CUSTOMER || type == ContactType.BOTH;
  }

  public boolean isSupplier() {
    return type == ContactType.SUPPLIER || type == ContactType.BOTH;
  }

  /** Whether this contact can be the counterparty of a cash movement in the given direction. */
  public boolean canTransact(AllocationDirection direction) {
    return direction == AllocationDirection.RECEIPT ? isCustomer() : isSupplier();
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

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public ContactType getType() {
    return type;
  }

  public void setType(ContactType type) {
    this.type = type;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
