package com.cred.freestyle.registration.api.dto;

import com.cred.freestyle.registration.domain.model.Offering;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Offering detail, including whether registration is currently open.
 *
 * @author Registration Team
 */
public class OfferingResponse {

    private Long id;
    private String kind;
    private String title;
    private String description;
    private BigDecimal price;
    private Instant startAt;
    private Instant endAt;
    private Integer registrationCount;
    private boolean available;

    public OfferingResponse() {
    }

    public static OfferingResponse fromEntity(Offering offering, Instant now) {
        OfferingResponse response = new OfferingResponse();
        response.setId(offering.getId());
        response.setKind(offering.getKind().getCode());
        response.setTitle(offering.getTitle());
        response.setDescription(offering.getDescription());
        response.setPrice(offering.getPrice());
        response.setStartAt(offering.getStartAt());
        response.setEndAt(offering.getEndAt());
        response.setRegistrationCount(offering.getRegistrationCount());
        response.setAvailable(offering.isAvailableAt(now));
        return response;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public Instant getStartAt() {
        return startAt;
    }

    public void setStartAt(Instant startAt) {
        this.startAt = startAt;
    }

    public Instant getEndAt() {
        return endAt;
    }

    public void setEndAt(Instant endAt) {
        this.endAt = endAt;
    }

    public Integer getRegistrationCount() {
        return registrationCount;
    }

    public void setRegistrationCount(Integer registrationCount) {
        this.registrationCount = registrationCount;
    }

    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }
}
