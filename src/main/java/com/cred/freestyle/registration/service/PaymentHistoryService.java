package com.cred.freestyle.registration.service;

import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.registration.domain.model.Registration;
import com.cred.freestyle.registration.exception.PaymentAccessDeniedException;
import com.cred.freestyle.registration.exception.ResourceNotFoundException;
import com.cred.freestyle.registration.repository.PaymentRepository;
import com.cred.freestyle.registration.repository.RegistrationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read side for a user's own payments.
 * Each payment is paired with the application time of its registration, when one exists.
 *
 * @author Registration Team
 */
@Service
public class PaymentHistoryService {

    private static final Instant OPEN_END = Instant.parse("9999-12-31T23:59:59Z");

    private final PaymentRepository paymentRepository;
    private final RegistrationRepository registrationRepository;

    public PaymentHistoryService(PaymentRepository paymentRepository, RegistrationRepository registrationRepository) {
        this.paymentRepository = paymentRepository;
        this.registrationRepository = registrationRepository;
    }

    /**
     * List the user's payments, newest first.
     * Date bounds are calendar days in UTC and both are inclusive.
     *
     * @param userId Authenticated user
     * @param status Optional status filter, null for all
     * @param kind Optional target kind filter, null for all
     * @param from Optional first paid date
     * @param to Optional last paid date
     * @return Payment history entries
     * @throws IllegalArgumentException if from is after to
     */
    @Transactional(readOnly = true)
    public List<Entry> getPaymentHistory(
            String userId,
            PaymentStatus status,
            OfferingKind kind,
            LocalDate from,
            LocalDate to
    ) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("'from' (" + from + ") must not be after 'to' (" + to + ")");
        }

        Set<PaymentStatus> statuses = status == null ? EnumSet.allOf(PaymentStatus.class) : EnumSet.of(status);
        Set<OfferingKind> kinds = kind == null ? EnumSet.allOf(OfferingKind.class) : EnumSet.of(kind);
        Instant lower = from == null ? Instant.EPOCH : from.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant upper = to == null ? OPEN_END : to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        List<Payment> payments = paymentRepository.findHistory(userId, statuses, kinds, lower, upper);
        return toEntries(userId, payments);
    }

    /**
     * Load one of the user's payments.
     *
     * @param userId Authenticated user
     * @param paymentId Payment ID
     * @return Payment with its registration time
     * @throws ResourceNotFoundException if the payment does not exist
     * @throws PaymentAccessDeniedException if the payment belongs to another user
     */
    @Transactional(readOnly = true)
    public Entry getPayment(String userId, Long paymentId) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", String.valueOf(paymentId)));
        if (!payment.getUserId().equals(userId)) {
            throw new PaymentAccessDeniedException(paymentId);
        }
        return toEntries(userId, List.of(payment)).get(0);
    }

    private List<Entry> toEntries(String userId, List<Payment> payments) {
        Map<OfferingKind, Map<Long, Instant>> appliedAt = loadApplicationTimes(userId, payments);

        List<Entry> entries = new ArrayList<>(payments.size());
        for (Payment payment : payments) {
            Instant registeredAt = appliedAt
                    .getOrDefault(payment.getTargetKind(), Map.of())
                    .get(payment.getTargetId());
            entries.add(new Entry(payment, registeredAt));
        }
        return entries;
    }

    private Map<OfferingKind, Map<Long, Instant>> loadApplicationTimes(String userId, List<Payment> payments) {
        Map<OfferingKind, Map<Long, Instant>> result = new EnumMap<>(OfferingKind.class);
        Map<OfferingKind, Set<Long>> targets = payments.stream()
                .collect(Collectors.groupingBy(Payment::getTargetKind,
                        Collectors.mapping(Payment::getTargetId, Collectors.toSet())));

        for (Map.Entry<OfferingKind, Set<Long>> target : targets.entrySet()) {
            Map<Long, Instant> times = new HashMap<>();
            for (Registration registration : registrationRepository.findByUserIdAndOfferingKindAndOfferingIdIn(
                    userId, target.getKey(), target.getValue())) {
                times.put(registration.getOfferingId(), registration.getAppliedAt());
            }
            result.put(target.getKey(), times);
        }
        return result;
    }

    /**
     * A payment with its registration time.
     */
    public static class Entry {

        private final Payment payment;
        private final Instant registeredAt;

        public Entry(Payment payment, Instant registeredAt) {
            this.payment = payment;
            this.registeredAt = registeredAt;
        }

        public Payment getPayment() {
            return payment;
        }

        public Instant getRegisteredAt() {
            return registeredAt;
        }
    }
}
