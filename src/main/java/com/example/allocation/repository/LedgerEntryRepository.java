package com.example.allocation.repository;

import com.example.allocation.domain.Account;
import com.example.allocation.domain.LedgerEntry;
import com.example.allocation.domain.Voucher;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    List<LedgerEntry> findByVoucher(Voucher voucher);

    boolean existsByVoucher(Voucher voucher);

    // Net balance of an account: debits minus credits
    @Query("SELECT COALESCE(SUM(le.amountDr), 0) - COALESCE(SUM(le.amountCr), 0) " +
           "FROM LedgerEntry le WHERE le.account = :account")
    BigDecimal netBalanceByAccount(@Param("account") Account account);
}
