package com.example.allocation.api.dto;

import jakarta.validation.constraints.Size;

public record ReverseVoucherRequest(@Size(max = 255) String reason) {}
