package com.cred.freestyle.registration.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discriminator for the two offering families.
 * The same kind value is stored on offerings, registrations and payment targets.
 *
 * @author Registration Team
 */
public enum OfferingKind {

    TEST("test"),

    COURSE("course");

    private final String code;

    OfferingKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolve a kind from its lower-case code ("test", "course").
     *
     * @param code Kind code
     * @return Matching kind
     * @throws IllegalArgumentException if the code is unknown
     */
    public static OfferingKind fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (OfferingKind kind : values()) {
                if (kind.code.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported offering kind: " + code);
    }
}
