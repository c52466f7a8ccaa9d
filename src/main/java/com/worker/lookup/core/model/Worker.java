package com.worker.lookup.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The slice of a worker record the check-in lookup needs.
 * Full worker profiles live in the persistence layer; this is what search returns.
 */
public record Worker(long id, String firstName, String lastName, String email, String phone) {

    public String fullName() {
        StringBuilder sb = new StringBuilder();
        if (firstName != null) {
            sb.append(firstName);
        }
        if (lastName != null) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(lastName);
        }
        return sb.toString();
    }

    /**
     * Texts the ranker compares against the term: full name, email and phone.
     * Missing fields are skipped.
     */
    public List<String> searchableTexts() {
        List<String> texts = new ArrayList<>(3);
        String fullName = fullName();
        if (!fullName.isEmpty()) {
            texts.add(fullName);
        }
        if (email != null) {
            texts.add(email);
        }
        if (phone != null) {
            texts.add(phone);
        }
        return texts;
    }
}
