package com.example.allocation.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;

/** An invoice issued to a customer. Settled by receipts. */
@Entity
@DiscriminatorValue("INVOICE")
public class SalesInvoice extends Document {

  public SalesInvoice() {}

  public SalesInvoice(
      Company company, Contact customer, String invoiceNumber, LocalDate dueDate, BigDecimal total) {
    super(company, customer, invoiceNumber, dueDate, total);
  }

  @Override
  public AllocationDirection getSettlingDirection() {
    return AllocationDirection.RECEIPT;
  }

  @Override
  public String getDisplayName() {
    return "Invoice " + getDocumentNumber();
  }
}
