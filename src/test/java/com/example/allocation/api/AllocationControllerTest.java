package com.example.allocation.api;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.example.allocation.domain.*;
import com.example.allocation.service.AllocationRequest;
import com.example.allocation.service.AllocationService;
import com.example.allocation.service.CompanyService;
import com.example.allocation.service.ValidationResult;
import com.example.allocation.service.ValidationResult.Violation;
import com.example.allocation.service.ValidationRule;
import com.example.allocation.service.VoucherPostingService;
import com.example.allocation.service.exception.ConcurrentAllocationException;
import com.example.allocation.service.exception.FatalConfigurationException;
import com.example.allocation.service.exception.InvalidStateException;
import com.example.allocation.service.exception.LedgerValidationException;
import com.example.allocation.service.exception.ResourceNotFoundException;

@WebMvcTest(controllers = {AllocationController.class, VoucherController.class})
class AllocationControllerTest {

  private static final String FIFO_BODY =
      """
      {
        "direction": "RECEIPT",
        "strategy": "FIFO",
        "totalAmount": 450.00,
        "paymentDate": "2026-01-25",
        "cashAccountId": 1,
        "counterpartyId": 10
      }
      """;

  @Autowired private MockMvc mockMvc;

  @MockBean private AllocationService allocationService;

  @MockBean private VoucherPostingService voucherPostingService;

  @MockBean private CompanyService companyService;

  private Company company;
  private Account bank;
  private Account receivable;
  private Contact customer;

  @BeforeEach
  void setUp() {
    company = new Company("Test Company", "USD");
    company.setId(1L);
    bank = new Account(company, "1000", "Bank", Account.AccountType.ASSET);
    bank.setId(1L);
    receivable = new Account(company, "1200", "Accounts Receivable", Account.AccountType.ASSET);
    receivable.setId(2L);
    customer = new Contact(company, "CUST01", "Acme Retail", Contact.ContactType.CUSTOMER);
    customer.setId(10L);
  }

  @Test
  void create_PostedAllocation_Returns201WithBreakdown() throws Exception {
    // Given
    when(allocationService.createAllocation(any())).thenReturn(postedGroup());

    // When / Then
    mockMvc
        .perform(
            post("/api/allocations").contentType(MediaType.APPLICATION_JSON).content(FIFO_BODY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.status").value("POSTED"))
        .andExpect(jsonPath("$.voucherNumber").value("RV-00001"))
        .andExpect(jsonPath("$.cashAccountCode").value("1000"))
        .andExpect(jsonPath("$.counterAccountCode").value("1200"))
        .andExpect(jsonPath("$.records.length()").value(2))
        .andExpect(jsonPath("$.records[0].documentNumber").value("INV-1"));

    ArgumentCaptor<AllocationRequest> captor = ArgumentCaptor.forClass(AllocationRequest.class);
    verify(allocationService).createAllocation(captor.capture());
    assertEquals(AllocationStrategy.FIFO, captor.getValue().strategy());
    assertTrue(captor.getValue().lines().isEmpty());
    assertEquals(0, new BigDecimal("450.00").compareTo(captor.getValue().totalAmount()));
  }

  @Test
  void create_MissingCounterparty_Returns400WithFieldErrors() throws Exception {
    // When / Then
    mockMvc
        .perform(
            post("/api/allocations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"direction\":\"RECEIPT\",\"strategy\":\"FIFO\",\"totalAmount\":10}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
        .andExpect(jsonPath("$.fieldErrors.counterpartyId").value("Counterparty is required"));

    verifyNoInteractions(allocationService);
  }

  @Test
  void create_RuleViolations_Returns400WithEveryViolation() throws Exception {
    // Given
    ValidationResult result =
        ValidationResult.of(
            List.of(
                Violation.forLine(
                    ValidationRule.EXCEEDS_AMOUNT_DUE, 0, 5L, "Line 1: 400 exceeds 300"),
                Violation.of(ValidationRule.UNBALANCED, "Allocated 400 but payment is 450")));
    when(allocationService.createAllocation(any()))
        .thenThrow(new LedgerValidationException(result));

    // When / Then
    mockMvc
        .perform(
            post("/api/allocations").contentType(MediaType.APPLICATION_JSON).content(FIFO_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
        .andExpect(jsonPath("$.violations.length()").value(2))
        .andExpect(jsonPath("$.violations[0].rule").value("EXCEEDS_AMOUNT_DUE"))
        .andExpect(jsonPath("$.violations[0].line").value(1))
        .andExpect(jsonPath("$.violations[0].documentId").value(5))
        .andExpect(jsonPath("$.violations[1].rule").value("UNBALANCED"));
  }

  @Test
  void create_UnknownCounterparty_Returns404() throws Exception {
    // Given
    when(allocationService.createAllocation(any()))
        .thenThrow(new ResourceNotFoundException("Contact", 10L));

    // When / Then
    mockMvc
        .perform(
            post("/api/allocations").contentType(MediaType.APPLICATION_JSON).content(FIFO_BODY))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void create_DocumentSettledConcurrently_Returns409Retryable() throws Exception {
    // Given
    when(allocationService.createAllocation(any()))
        .thenThrow(new ConcurrentAllocationException(5L, "Invoice INV-1 now has only 0.00 due"));

    // When / Then
    mockMvc
        .perform(
            post("/api/allocations").contentType(MediaType.APPLICATION_JSON).content(FIFO_BODY))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONCURRENT_ALLOCATION"))
        .andExpect(jsonPath("$.retryable").value(true));
  }

  @Test
  void create_CounterAccountMissing_Returns500ConfigurationError() throws Exception {
    // Given
    when(allocationService.createAllocation(any()))
        .thenThrow(new FatalConfigurationException("No receivable account configured"));

    // When / Then
    mockMvc
        .perform(
            post("/api/allocations").contentType(MediaType.APPLICATION_JSON).content(FIFO_BODY))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("CONFIGURATION_ERROR"))
        .andExpect(jsonPath("$.retryable").doesNotExist());
  }

  @Test
  void reverse_AlreadyReversed_Returns409() throws Exception {
    // Given
    when(allocationService.reverseAllocation(7L))
        .thenThrow(new InvalidStateException("Allocation 7 is already reversed"));

    // When / Then
    mockMvc
        .perform(post("/api/allocations/7/reverse"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INVALID_STATE"))
        .andExpect(jsonPath("$.message").value("Allocation 7 is already reversed"));
  }

  @Test
  void propose_InvalidStrategy_Returns400() throws Exception {
    // When / Then
    mockMvc
        .perform(
            get("/api/allocations/proposal")
                .param("strategy", "LIFO")
                .param("counterpartyId", "10")
                .param("direction", "RECEIPT")
                .param("totalAmount", "100"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

    verifyNoInteractions(allocationService);
  }

  @Test
  void createVoucher_DepositAlias_IsPostedAsReceipt() throws Exception {
    // Given
    Voucher voucher =
        new Voucher(
            company,
            VoucherType.RECEIPT,
            new BigDecimal("75.00"),
            bank,
            receivable,
            LocalDate.of(2026, 1, 25));
    voucher.setId(3L);
    voucher.setVoucherNumber("RV-00001");
    voucher.markPosted();
    when(voucherPostingService.createVoucher(any())).thenReturn(voucher);

    // When / Then
    mockMvc
        .perform(
            post("/api/vouchers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"voucherType\":\"deposit\",\"amount\":75.00,"
                        + "\"debitAccountId\":1,\"creditAccountId\":2}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.voucherNumber").value("RV-00001"));

    ArgumentCaptor<VoucherPostingService.VoucherRequest> captor =
        ArgumentCaptor.forClass(VoucherPostingService.VoucherRequest.class);
    verify(voucherPostingService).createVoucher(captor.capture());
    assertEquals(VoucherType.RECEIPT, captor.getValue().type());
  }

  @Test
  void createVoucher_UnknownType_Returns400() throws Exception {
    // When / Then
    mockMvc
        .perform(
            post("/api/vouchers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"voucherType\":\"TRANSFER\",\"amount\":75.00,"
                        + "\"debitAccountId\":1,\"creditAccountId\":2}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

    verifyNoInteractions(voucherPostingService);
  }

  private AllocationGroup postedGroup() {
    Document inv1 = invoice(5L, "INV-1", "300.00");
    Document inv2 = invoice(6L, "INV-2", "200.00");
    AllocationGroup group =
        new AllocationGroup(
            company,
            AllocationDirection.RECEIPT,
            AllocationStrategy.FIFO,
            new BigDecimal("450.00"),
            customer,
            bank,
            LocalDate.of(2026, 1, 25));
    group.setId(7L);
    group.setCounterAccount(receivable);
    group.addRecord(new AllocationRecord(inv1, new BigDecimal("300.00"), null));
    group.addRecord(new AllocationRecord(inv2, new BigDecimal("150.00"), null));

    Voucher voucher =
        new Voucher(
            company,
            VoucherType.RECEIPT,
            new BigDecimal("450.00"),
            bank,
            receivable,
            LocalDate.of(2026, 1, 25));
    voucher.setId(3L);
    voucher.setVoucherNumber("RV-00001");
    voucher.markPosted();
    group.markPosted(voucher, new BigDecimal("0.01"));
    return group;
  }

  private Document invoice(Long id, String number, String total) {
    SalesInvoice invoice =
        new SalesInvoice(company, customer, number, LocalDate.of(2026, 1, 10), new BigDecimal(total));
    invoice.setId(id);
    return invoice;
  }
}
