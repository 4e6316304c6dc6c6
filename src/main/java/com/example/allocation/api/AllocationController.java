package com.example.allocation.api;

import java.math.BigDecimal;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.allocation.api.dto.AllocationResponse;
import com.example.allocation.api.dto.CreateAllocationRequest;
import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.domain.AllocationGroup;
import com.example.allocation.domain.AllocationStrategy;
import com.example.allocation.service.AllocationProposal;
import com.example.allocation.service.AllocationService;

import jakarta.validation.Valid;

/**
 * REST binding for proposing, creating, reading and reversing allocations.
 *
 * <p>Create answers 201 only once the group is POSTED; every rejection is an error status.
 */
@RestController
@RequestMapping("/api/allocations")
public class AllocationController {

  private static final Logger log = LoggerFactory.getLogger(AllocationController.class);

  private final AllocationService allocationService;

  public AllocationController(AllocationService allocationService) {
    this.allocationService = allocationService;
  }

  @GetMapping("/proposal")
  public AllocationProposal propose(
      @RequestParam("strategy") AllocationStrategy strategy,
      @RequestParam("counterpartyId") Long counterpartyId,
      @RequestParam("direction") AllocationDirection direction,
      @RequestParam("totalAmount") BigDecimal totalAmount) {
    return allocationService.proposeAllocation(strategy, counterpartyId, direction, totalAmount);
  }

  @PostMapping
  public ResponseEntity<AllocationResponse> create(
      @Valid @RequestBody CreateAllocationRequest request) {
    log.info(
        "Allocation requested: {} {} of {} for counterparty {}",
        request.direction(),
        request.strategy(),
        request.totalAmount(),
        request.counterpartyId());
    AllocationGroup group = allocationService.createAllocation(request.toCommand());
    return ResponseEntity.status(HttpStatus.CREATED).body(AllocationResponse.from(group));
  }

  @PostMapping("/{id}/reverse")
  public AllocationResponse reverse(@PathVariable("id") Long id) {
    return AllocationResponse.from(allocationService.reverseAllocation(id));
  }

  @GetMapping("/{id}")
  public AllocationResponse get(@PathVariable("id") Long id) {
    return AllocationResponse.from(allocationService.getAllocation(id));
  }

  @GetMapping
  public List<AllocationResponse> list(@RequestParam("counterpartyId") Long counterpartyId) {
    return allocationService.listAllocations(counterpartyId).stream()
        .map(AllocationResponse::from)
        .toList();
  }
}
