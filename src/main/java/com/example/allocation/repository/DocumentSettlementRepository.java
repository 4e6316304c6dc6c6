package com.example.allocation.repository;

import com.example.allocation.domain.Document;
import com.example.allocation.domain.DocumentSettlement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface DocumentSettlementRepository extends JpaRepository<DocumentSettlement, Long> {

    List<DocumentSettlement> findByDocumentOrderByIdAsc(Document document);

    // Total of live settlements against a document
    @Query("SELECT COALESCE(SUM(s.amount), 0) FROM DocumentSettlement s " +
           "WHERE s.document = :document AND s.voided = false")
    BigDecimal sumActiveByDocument(@Param("document") Document document);
}
