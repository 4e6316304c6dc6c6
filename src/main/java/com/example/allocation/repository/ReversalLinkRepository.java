package com.example.allocation.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.allocation.domain.ReversalLink;
import com.example.allocation.domain.Voucher;

/** Repository for ReversalLink entities. Answers which voucher reversed which. */
@Repository
public interface ReversalLinkRepository extends JpaRepository<ReversalLink, Long> {

  /** Find the link where this voucher was reversed. */
  Optional<ReversalLink> findByOriginalVoucher(Voucher originalVoucher);

  /** Check if a voucher has been reversed. */
  boolean existsByOriginalVoucher(Voucher originalVoucher);

  /** Check if a voucher is itself the reversal of another voucher. */
  boolean existsByReversingVoucher(Voucher reversingVoucher);
}
