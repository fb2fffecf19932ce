package com.contacthub.backend.modules.contact.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.contacthub.backend.modules.contact.domain.Contact;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ContactRepository extends JpaRepository<Contact, UUID>, ContactRepositoryCustom {

    Optional<Contact> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<Contact> findByOwnerIdAndBirthdayIsNotNull(UUID ownerId);
}
