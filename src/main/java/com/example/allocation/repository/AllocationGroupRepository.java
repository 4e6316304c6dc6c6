package com.example.allocation.repository;

import com.example.allocation.domain.AllocationGroup;
import com.example.allocation.domain.Contact;
import com.example.allocation.domain.Voucher;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AllocationGroupRepository extends JpaRepository<AllocationGroup, Long> {

    // Group with its records and their documents, for read paths
    @Query("SELECT DISTINCT g FROM AllocationGroup g " +
           "LEFT JOIN FETCH g.records r LEFT JOIN FETCH r.document " +
           "WHERE g.id = :id")
    Optional<AllocationGroup> findWithRecordsById(@Param("id") Long id);

    // Serializes concurrent reversals of the same group
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM AllocationGroup g WHERE g.id = :id")
    Optional<AllocationGroup> findByIdForUpdate(@Param("id") Long id);

    List<AllocationGroup> findByContactOrderByCreatedAtDesc(Contact contact);

    boolean existsByVoucher(Voucher voucher);
}
