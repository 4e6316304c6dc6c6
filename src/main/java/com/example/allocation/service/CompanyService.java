package com.example.allocation.service;

import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.allocation.domain.Company;
import com.example.allocation.repository.CompanyRepository;
import com.example.allocation.service.exception.ResourceNotFoundException;

/** Tenant lookup. */
@Service
@Transactional(readOnly = true)
public class CompanyService {

  private final CompanyRepository companyRepository;

  public CompanyService(CompanyRepository companyRepository) {
    this.companyRepository = companyRepository;
  }

  public Company getCompany(Long id) {
    if (id == null) {
      throw new ResourceNotFoundException("Company", null);
    }
    return companyRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Company", id));
  }

  public Optional<Company> findByName(String name) {
    return companyRepository.findByName(name);
  }
}
