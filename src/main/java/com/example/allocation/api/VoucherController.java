package com.example.allocation.api;

import java.time.LocalDate;
import java.util.List;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.allocation.api.dto.CreateVoucherRequest;
import com.example.allocation.api.dto.ReverseVoucherRequest;
import com.example.allocation.api.dto.VoucherResponse;
import com.example.allocation.domain.Voucher;
import com.example.allocation.domain.VoucherType;
import com.example.allocation.service.CompanyService;
import com.example.allocation.service.VoucherPostingService;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/vouchers")
public class VoucherController {

  private final VoucherPostingService voucherPostingService;
  private final CompanyService companyService;

  public VoucherController(
      VoucherPostingService voucherPostingService, CompanyService companyService) {
    this.voucherPostingService = voucherPostingService;
    this.companyService = companyService;
  }

  @PostMapping
  public ResponseEntity<VoucherResponse> create(@Valid @RequestBody CreateVoucherRequest request) {
    Voucher voucher = voucherPostingService.createVoucher(request.toCommand());
    return ResponseEntity.status(HttpStatus.CREATED).body(VoucherResponse.from(voucher));
  }

  /** Reverses a standalone voucher; the response is the compensating journal voucher. */
  @PostMapping("/{id}/reverse")
  public VoucherResponse reverse(
      @PathVariable("id") Long id,
      @Valid @RequestBody(required = false) ReverseVoucherRequest request) {
    String reason = request != null ? request.reason() : null;
    return VoucherResponse.from(voucherPostingService.reverseVoucher(id, reason));
  }

  @GetMapping("/{id}")
  public VoucherResponse get(@PathVariable("id") Long id) {
    return VoucherResponse.from(voucherPostingService.getVoucher(id));
  }

  @GetMapping
  public List<VoucherResponse> list(
      @RequestParam("companyId") Long companyId,
      @RequestParam(value = "type", required = false) String type,
      @RequestParam(value = "status", required = false) Voucher.Status status,
      @RequestParam(value = "from", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate from,
      @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate to) {
    VoucherType voucherType = type != null ? VoucherType.fromInput(type) : null;
    return voucherPostingService
        .listVouchers(companyService.getCompany(companyId), voucherType, status, from, to)
        .stream()
        .map(VoucherResponse::from)
        .toList();
  }
}
