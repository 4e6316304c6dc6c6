package com.example.allocation.repository;

import com.example.allocation.domain.Company;
import com.example.allocation.domain.Voucher;
import com.example.allocation.domain.VoucherType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface VoucherRepository extends JpaRepository<Voucher, Long> {

    long countByCompanyAndType(Company company, VoucherType type);

    // Filtered listing; null parameters match everything
    @Query("SELECT v FROM Voucher v WHERE v.company = :company " +
           "AND (:type IS NULL OR v.type = :type) " +
           "AND (:status IS NULL OR v.status = :status) " +
           "AND (:fromDate IS NULL OR v.transactionDate >= :fromDate) " +
           "AND (:toDate IS NULL OR v.transactionDate <= :toDate) " +
           "ORDER BY v.transactionDate DESC, v.id DESC")
    List<Voucher> search(@Param("company") Company company,
                         @Param("type") VoucherType type,
                         @Param("status") Voucher.Status status,
                         @Param("fromDate") LocalDate fromDate,
                         @Param("toDate") LocalDate toDate);
}
