package com.example.allocation.repository;

import com.example.allocation.domain.Company;
import com.example.allocation.domain.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ContactRepository extends JpaRepository<Contact, Long> {

    Optional<Contact> findByCompanyAndCode(Company company, String code);

    List<Contact> findByCompanyOrderByName(Company company);
}
