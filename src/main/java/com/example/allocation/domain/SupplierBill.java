package com.example.allocation.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;

/** A bill received from a supplier. Settled by payments. */
@Entity
@DiscriminatorValue("BILL")
public class SupplierBill extends Document {

  public SupplierBill() {}

  public SupplierBill(
      Company company, Contact supplier, String billNumber, LocalDate dueDate, BigDecimal total) {
    super(company, supplier, billNumber, dueDate, total);
  }

  @Override
  public AllocationDirection getSettlingDirection() {
    return AllocationDirection.PAYMENT;
  }

  @Override
  public String getDisplayName() {
    return "Bill " + getDocumentNumber();
  }
}
