package com.cred.freestyle.registration.domain.model;

import java.util.Objects;

/**
 * Discriminated reference to an offering: (kind, id).
 * Payments and registrations point at offerings through this pair, never through a typed association.
 *
 * @author Registration Team
 */
public final class OfferingRef {

    private final OfferingKind kind;
    private final Long id;

    private OfferingRef(OfferingKind kind, Long id) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
    }

    public static OfferingRef of(OfferingKind kind, Long id) {
        return new OfferingRef(kind, id);
    }

    public static OfferingRef test(Long id) {
        return new OfferingRef(OfferingKind.TEST, id);
    }

    public static OfferingRef course(Long id) {
        return new OfferingRef(OfferingKind.COURSE, id);
    }

    public OfferingKind getKind() {
        return kind;
    }

    public Long getId() {
        return id;
    }

    /**
     * Key fragment used by locks, cache keys and event keys, e.g. {@code test:42}.
     */
    public String asKey() {
        return kind.getCode() + ":" + id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OfferingRef)) {
            return false;
        }
        OfferingRef that = (OfferingRef) o;
        return kind == that.kind && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return asKey();
    }
}
