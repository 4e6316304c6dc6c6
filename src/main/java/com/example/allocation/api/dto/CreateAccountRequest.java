package com.example.allocation.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /api/accounts}. The type accepts the legacy {@code REVENUE} name. */
public record CreateAccountRequest(
    @NotNull(message = "Company is required") Long companyId,
    @NotBlank(message = "Code is required") @Size(max = 20) String code,
    @NotBlank(message = "Name is required") @Size(max = 100) String name,
    @NotBlank(message = "Type is required") String type,
    boolean bankAccount) {}
