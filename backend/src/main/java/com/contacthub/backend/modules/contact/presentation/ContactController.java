package com.contacthub.backend.modules.contact.presentation;

import java.util.List;
import java.util.UUID;

import com.contacthub.backend.global.security.SecurityUtils;
import com.contacthub.backend.modules.contact.application.ContactService;
import com.contacthub.backend.modules.contact.presentation.dto.ContactRequest;
import com.contacthub.backend.modules.contact.presentation.dto.ContactResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/contacts")
@Tag(name = "contacts")
public class ContactController {

    private final ContactService contactService;

    public ContactController(ContactService contactService) {
        this.contactService = contactService;
    }

    @PostMapping
    @Operation(summary = "Add a contact to the caller's address book")
    public ResponseEntity<ContactResponse> create(@Valid @RequestBody ContactRequest request) {
        return ResponseEntity.status(201).body(contactService.create(currentOwnerId(), request));
    }

    @GetMapping
    @Operation(summary = "List contacts, optionally filtered by name, surname or email")
    public ResponseEntity<List<ContactResponse>> list(
            @RequestParam(name = "name", required = false) String name,
            @RequestParam(name = "surname", required = false) String surname,
            @RequestParam(name = "email", required = false) String email,
            @RequestParam(name = "skip", defaultValue = "0") int skip,
            @RequestParam(name = "limit", defaultValue = "10") int limit
    ) {
        return ResponseEntity.ok(contactService.list(currentOwnerId(), name, surname, email, skip, limit));
    }

    @GetMapping("/birthdays")
    @Operation(summary = "Contacts with a birthday in the next given number of days")
    public ResponseEntity<List<ContactResponse>> upcomingBirthdays(
            @RequestParam(name = "days", defaultValue = "7") int days
    ) {
        return ResponseEntity.ok(contactService.upcomingBirthdays(currentOwnerId(), days));
    }

    @GetMapping("/{contactId}")
    public ResponseEntity<ContactResponse> get(@PathVariable("contactId") UUID contactId) {
        return ResponseEntity.ok(contactService.get(currentOwnerId(), contactId));
    }

    @PutMapping("/{contactId}")
    public ResponseEntity<ContactResponse> update(
            @PathVariable("contactId") UUID contactId,
            @Valid @RequestBody ContactRequest request
    ) {
        return ResponseEntity.ok(contactService.update(currentOwnerId(), contactId, request));
    }

    @DeleteMapping("/{contactId}")
    @Operation(summary = "Delete a contact and return what was removed")
    public ResponseEntity<ContactResponse> delete(@PathVariable("contactId") UUID contactId) {
        return ResponseEntity.ok(contactService.delete(currentOwnerId(), contactId));
    }

    private static UUID currentOwnerId() {
        return SecurityUtils.getCurrentPrincipal().userId();
    }
}
