package com.contacthub.backend.modules.contact.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import com.contacthub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.contacthub.backend.modules.contact.domain.Contact;
import com.contacthub.backend.modules.contact.infrastructure.persistence.ContactRepository;
import com.contacthub.backend.modules.contact.infrastructure.persistence.ContactSearchCondition;
import com.contacthub.backend.modules.contact.presentation.dto.ContactRequest;
import com.contacthub.backend.modules.contact.presentation.dto.ContactResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Address book of the authenticated user. Every lookup is scoped by owner, so a contact
 * of another user reads as not found.
 */
@Service
public class ContactService {

    static final int MAX_PAGE_SIZE = 100;
    static final int MAX_BIRTHDAY_WINDOW_DAYS = 365;

    private static final Logger log = LoggerFactory.getLogger(ContactService.class);

    private final ContactRepository contactRepository;
    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    public ContactService(ContactRepository contactRepository, UserAccountRepository userAccountRepository, Clock clock) {
        this.contactRepository = contactRepository;
        this.userAccountRepository = userAccountRepository;
        this.clock = clock;
    }

    @Transactional
    public ContactResponse create(UUID ownerId, ContactRequest request) {
        Contact contact = new Contact(userAccountRepository.getReferenceById(ownerId));
        apply(contact, request);
        Contact saved = contactRepository.saveAndFlush(contact);
        log.debug("Contact {} created for owner {}", saved.getId(), ownerId);
        return ContactResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<ContactResponse> list(UUID ownerId, String name, String surname, String email, int skip, int limit) {
        if (skip < 0 || limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_PAGINATION");
        }
        ContactSearchCondition condition = new ContactSearchCondition(ownerId, name, surname, email, skip, limit);
        return contactRepository.search(condition).stream()
                .map(ContactResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public ContactResponse get(UUID ownerId, UUID contactId) {
        return ContactResponse.from(load(ownerId, contactId));
    }

    @Transactional
    public ContactResponse update(UUID ownerId, UUID contactId, ContactRequest request) {
        Contact contact = load(ownerId, contactId);
        apply(contact, request);
        return ContactResponse.from(contactRepository.saveAndFlush(contact));
    }

    @Transactional
    public ContactResponse delete(UUID ownerId, UUID contactId) {
        Contact contact = load(ownerId, contactId);
        ContactResponse removed = ContactResponse.from(contact);
        contactRepository.delete(contact);
        log.debug("Contact {} deleted for owner {}", contactId, ownerId);
        return removed;
    }

    /**
     * Contacts whose next birthday falls between today and {@code days} days from now,
     * soonest first. A 29 February birthday is celebrated on 28 February in other years.
     */
    @Transactional(readOnly = true)
    public List<ContactResponse> upcomingBirthdays(UUID ownerId, int days) {
        if (days < 0 || days > MAX_BIRTHDAY_WINDOW_DAYS) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_DAYS");
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate last = today.plusDays(days);
        return contactRepository.findByOwnerIdAndBirthdayIsNotNull(ownerId).stream()
                .filter(contact -> !nextBirthday(contact.getBirthday(), today).isAfter(last))
                .sorted(Comparator.comparing((Contact contact) -> nextBirthday(contact.getBirthday(), today))
                        .thenComparing(Contact::getSurname, String.CASE_INSENSITIVE_ORDER)
                        .thenComparing(Contact::getName, String.CASE_INSENSITIVE_ORDER))
                .map(ContactResponse::from)
                .toList();
    }

    static LocalDate nextBirthday(LocalDate birthday, LocalDate today) {
        MonthDay monthDay = MonthDay.from(birthday);
        LocalDate candidate = monthDay.atYear(today.getYear());
        if (candidate.isBefore(today)) {
            candidate = monthDay.atYear(today.getYear() + 1);
        }
        return candidate;
    }

    private Contact load(UUID ownerId, UUID contactId) {
        return contactRepository.findByIdAndOwnerId(contactId, ownerId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "CONTACT_NOT_FOUND"));
    }

    private static void apply(Contact contact, ContactRequest request) {
        contact.setName(request.name().trim());
        contact.setSurname(request.surname().trim());
        contact.setEmail(request.email().trim());
        contact.setPhone(request.phone().trim());
        contact.setBirthday(request.birthday());
        contact.setNotes(request.notes());
    }
}
