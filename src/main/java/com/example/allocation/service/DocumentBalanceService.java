package com.example.allocation.service;

import com.example.allocation.domain.*;
import com.example.allocation.repository.DocumentRepository;
import com.example.allocation.repository.DocumentSettlementRepository;
import com.example.allocation.service.exception.ResourceNotFoundException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves what is still owed on invoices and bills, and records or voids the settlements that
 * change it.
 *
 * The amount due is always computed from the live settlements in storage
 * (total minus their sum), never from the cached figure on the document, so a value read inside
 * a locking transaction reflects every committed settlement.
 */
@Service
@Transactional
public class DocumentBalanceService {

    private static final Logger log = LoggerFactory.getLogger(DocumentBalanceService.class);

    private final DocumentRepository documentRepository;
    private final DocumentSettlementRepository settlementRepository;

    @PersistenceContext
    private EntityManager entityManager;

    public DocumentBalanceService(DocumentRepository documentRepository,
                                  DocumentSettlementRepository settlementRepository) {
        this.documentRepository = documentRepository;
        this.settlementRepository = settlementRepository;
    }

    /**
     * Returns total minus the sum of live settlements.
     */
    @Transactional(readOnly = true)
    public BigDecimal amountDue(Document document) {
        BigDecimal settled = settlementRepository.sumActiveByDocument(document);
        return document.getTotal().subtract(settled != null ? settled : BigDecimal.ZERO);
    }

    /**
     * Lists the counterparty's documents that can be settled in the given direction and still
     * have something due, earliest due date first.
     */
    @Transactional(readOnly = true)
    public List<Document> listOutstanding(Contact contact, AllocationDirection direction) {
        List<? extends Document> candidates = direction == AllocationDirection.RECEIPT
            ? documentRepository.findInvoicesByContact(contact)
            : documentRepository.findBillsByContact(contact);

        List<Document> outstanding = new ArrayList<>();
        for (Document document : candidates) {
            if (amountDue(document).signum() > 0) {
                outstanding.add(document);
            }
        }
        return outstanding;
    }

    /**
     * Snapshots outstanding documents into the allocator's input form.
     */
    @Transactional(readOnly = true)
    public List<OutstandingDocument> toOutstanding(List<Document> documents) {
        List<OutstandingDocument> result = new ArrayList<>();
        for (Document document : documents) {
            result.add(new OutstandingDocument(document.getId(), document.getDocumentNumber(),
                document.getDueDate(), amountDue(document)));
        }
        return result;
    }

    @Transactional(readOnly = true)
    public Document getDocument(Long id) {
        return documentRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Document", id));
    }

    /**
     * Takes an update lock on a document for the rest of the transaction and reloads its state,
     * so a copy read earlier in the transaction carries the version committed by whoever held the
     * lock before.
     */
    public Document lockDocument(Long id) {
        Document document = documentRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("Document", id));
        entityManager.refresh(document);
        return document;
    }

    /**
     * Applies money against a document and refreshes its settled amount and status.
     *
     * @param record the allocation line that produced this settlement, or null for a settlement
     *               recorded outside an allocation
     */
    public DocumentSettlement recordSettlement(Document document, BigDecimal amount,
                                               LocalDate settlementDate, AllocationRecord record) {
        DocumentSettlement settlement = new DocumentSettlement(document, amount, settlementDate);
        if (record != null) {
            record.linkSettlement(settlement);
        }
        settlement = settlementRepository.save(settlement);
        refresh(document);

        log.debug("Settled {} against {}, now {}", amount, document.getDisplayName(),
            document.getStatus());
        return settlement;
    }

    /**
     * Voids a settlement so it no longer counts toward the document, then refreshes the document.
     */
    public void voidSettlement(DocumentSettlement settlement) {
        settlement.markVoided();
        settlementRepository.save(settlement);
        refresh(settlement.getDocument());
    }

    /**
     * Recomputes the cached settled amount and status from storage.
     */
    public Document refresh(Document document) {
        BigDecimal settled = settlementRepository.sumActiveByDocument(document);
        document.applySettledAmount(settled != null ? settled : BigDecimal.ZERO);
        return documentRepository.save(document);
    }
}
