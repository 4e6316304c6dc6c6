package com.example.allocation.api;

import java.math.BigDecimal;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.allocation.api.dto.AccountResponse;
import com.example.allocation.api.dto.CreateAccountRequest;
import com.example.allocation.domain.Account;
import com.example.allocation.service.AccountService;
import com.example.allocation.service.CompanyService;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/accounts")
public class AccountController {

  private final AccountService accountService;
  private final CompanyService companyService;

  public AccountController(AccountService accountService, CompanyService companyService) {
    this.accountService = accountService;
    this.companyService = companyService;
  }

  @PostMapping
  public ResponseEntity<AccountResponse> create(@Valid @RequestBody CreateAccountRequest request) {
    Account account =
        accountService.createAccount(
            companyService.getCompany(request.companyId()),
            request.code(),
            request.name(),
            Account.AccountType.fromInput(request.type()),
            request.bankAccount());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(AccountResponse.from(account, BigDecimal.ZERO));
  }

  @GetMapping("/{id}")
  public AccountResponse get(@PathVariable("id") Long id) {
    Account account = accountService.getAccount(id);
    return AccountResponse.from(account, accountService.getBalance(account));
  }
}
