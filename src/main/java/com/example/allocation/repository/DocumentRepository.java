package com.example.allocation.repository;

import com.example.allocation.domain.Contact;
import com.example.allocation.domain.Document;
import com.example.allocation.domain.SalesInvoice;
import com.example.allocation.domain.SupplierBill;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DocumentRepository extends JpaRepository<Document, Long> {

    // Update lock held until the surrounding transaction ends
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Document d WHERE d.id = :id")
    Optional<Document> findByIdForUpdate(@Param("id") Long id);

    // All invoices for a customer, earliest due first
    @Query("SELECT i FROM SalesInvoice i WHERE i.contact = :contact " +
           "ORDER BY i.dueDate ASC, i.documentNumber ASC")
    List<SalesInvoice> findInvoicesByContact(@Param("contact") Contact contact);

    // All bills from a supplier, earliest due first
    @Query("SELECT b FROM SupplierBill b WHERE b.contact = :contact " +
           "ORDER BY b.dueDate ASC, b.documentNumber ASC")
    List<SupplierBill> findBillsByContact(@Param("contact") Contact contact);
}
