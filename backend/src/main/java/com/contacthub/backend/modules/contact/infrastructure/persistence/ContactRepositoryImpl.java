package com.contacthub.backend.modules.contact.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.contacthub.backend.modules.contact.domain.Contact;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class ContactRepositoryImpl implements ContactRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Contact> search(ContactSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(condition.ownerId(), "ownerId must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        whereClauses.add("c.owner.id = :ownerId");
        params.put("ownerId", condition.ownerId());
        addContains(whereClauses, params, "name", condition.name());
        addContains(whereClauses, params, "surname", condition.surname());
        addContains(whereClauses, params, "email", condition.email());

        String jpql = "SELECT c FROM Contact c WHERE " + String.join(" AND ", whereClauses)
                + " ORDER BY lower(c.surname), lower(c.name), c.id";
        TypedQuery<Contact> query = entityManager.createQuery(jpql, Contact.class);
        params.forEach(query::setParameter);
        query.setFirstResult(condition.skip());
        query.setMaxResults(condition.limit());
        return query.getResultList();
    }

    private static void addContains(List<String> whereClauses, Map<String, Object> params, String field, String value) {
        if (!StringUtils.hasText(value)) {
            return;
        }
        whereClauses.add("lower(c." + field + ") LIKE :" + field + " ESCAPE '!'");
        params.put(field, "%" + escapeLike(value.trim().toLowerCase(Locale.ROOT)) + "%");
    }

    private static String escapeLike(String value) {
        return value.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }
}
