package com.example.allocation.api;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.allocation.api.dto.DocumentResponse;
import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.service.AllocationService;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {

  private final AllocationService allocationService;

  public DocumentController(AllocationService allocationService) {
    this.allocationService = allocationService;
  }

  /** Invoices (RECEIPT) or bills (PAYMENT) of a counterparty that still have an amount due. */
  @GetMapping("/outstanding")
  public List<DocumentResponse> outstanding(
      @RequestParam("counterpartyId") Long counterpartyId,
      @RequestParam("direction") AllocationDirection direction) {
    return allocationService.listOutstandingDocuments(counterpartyId, direction).stream()
        .map(DocumentResponse::from)
        .toList();
  }
}
