package com.example.allocation.config;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.allocation.domain.Account.AccountType;
import com.example.allocation.domain.Company;
import com.example.allocation.domain.Contact;
import com.example.allocation.domain.Contact.ContactType;
import com.example.allocation.domain.Document;
import com.example.allocation.domain.SalesInvoice;
import com.example.allocation.domain.SupplierBill;
import com.example.allocation.repository.CompanyRepository;
import com.example.allocation.repository.ContactRepository;
import com.example.allocation.repository.DocumentRepository;
import com.example.allocation.service.AccountService;

/**
 * Seeds a demo company on startup: a small chart of accounts, one customer with three open
 * invoices and one supplier with two open bills. Disabled with {@code
 * ledger.demo-data.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "ledger.demo-data.enabled", havingValue = "true")
public class DataInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

  static final String DEMO_COMPANY = "Demo Company";
  private static final String DEMO_CURRENCY = "USD";

  private final CompanyRepository companyRepository;
  private final ContactRepository contactRepository;
  private final DocumentRepository documentRepository;
  private final AccountService accountService;

  public DataInitializer(
      CompanyRepository companyRepository,
      ContactRepository contactRepository,
      DocumentRepository documentRepository,
      AccountService accountService) {
    this.companyRepository = companyRepository;
    this.contactRepository = contactRepository;
    this.documentRepository = documentRepository;
    this.accountService = accountService;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (companyRepository.findByName(DEMO_COMPANY).isPresent()) {
      log.info("Demo company already exists: {}", DEMO_COMPANY);
      return;
    }

    log.info("Creating demo company: {}", DEMO_COMPANY);
    Company company = companyRepository.save(new Company(DEMO_COMPANY, DEMO_CURRENCY));

    accountService.createAccount(company, "1000", "Bank", AccountType.ASSET, true);
    company.setReceivableAccount(
        accountService.createAccount(
            company, "1200", "Accounts Receivable", AccountType.ASSET, false));
    company.setPayableAccount(
        accountService.createAccount(
            company, "2100", "Accounts Payable", AccountType.LIABILITY, false));
    accountService.createAccount(company, "4000", "Sales", AccountType.INCOME, false);
    accountService.createAccount(company, "5000", "Expenses", AccountType.EXPENSE, false);
    companyRepository.save(company);

    Contact customer =
        contactRepository.save(
            new Contact(company, "CUST01", "Acme Retail", ContactType.CUSTOMER));
    Contact supplier =
        contactRepository.save(
            new Contact(company, "SUPP01", "Northwind Supplies", ContactType.SUPPLIER));

    LocalDate today = LocalDate.now();
    save(new SalesInvoice(company, customer, "INV-1", today.plusDays(10), amount("300.00")));
    save(new SalesInvoice(company, customer, "INV-2", today.plusDays(20), amount("200.00")));
    save(new SalesInvoice(company, customer, "INV-3", today.plusDays(30), amount("100.00")));
    save(new SupplierBill(company, supplier, "BILL-1", today.plusDays(14), amount("150.00")));
    save(new SupplierBill(company, supplier, "BILL-2", today.plusDays(28), amount("250.00")));

    log.info("Demo company created with accounts 1000-5000, 1 customer and 1 supplier");
  }

  private void save(Document document) {
    document.setIssueDate(LocalDate.now());
    document.setCurrency(document.getCompany().getCurrency());
    documentRepository.save(document);
  }

  private static BigDecimal amount(String value) {
    return new BigDecimal(value);
  }
}
