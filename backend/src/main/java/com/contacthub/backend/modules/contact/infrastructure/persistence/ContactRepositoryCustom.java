package com.contacthub.backend.modules.contact.infrastructure.persistence;

import java.util.List;

import com.contacthub.backend.modules.contact.domain.Contact;

public interface ContactRepositoryCustom {

    List<Contact> search(ContactSearchCondition condition);
}
