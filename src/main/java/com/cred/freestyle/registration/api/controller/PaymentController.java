package com.cred.freestyle.registration.api.controller;

import com.cred.freestyle.registration.api.dto.CancelRequest;
import com.cred.freestyle.registration.api.dto.CancelResponse;
import com.cred.freestyle.registration.api.dto.PaymentResponse;
import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.registration.security.SecurityUtils;
import com.cred.freestyle.registration.service.CancelResult;
import com.cred.freestyle.registration.service.PaymentHistoryService;
import com.cred.freestyle.registration.service.RegistrationCoordinator;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * REST controller for payment cancellation and the caller's payment history.
 *
 * @author Registration Team
 */
@RestController
@RequestMapping("/api/v1")
public class PaymentController {

    private final RegistrationCoordinator registrationCoordinator;
    private final PaymentHistoryService paymentHistoryService;

    public PaymentController(
            RegistrationCoordinator registrationCoordinator,
            PaymentHistoryService paymentHistoryService
    ) {
        this.registrationCoordinator = registrationCoordinator;
        this.paymentHistoryService = paymentHistoryService;
    }

    /**
     * Cancel one of the caller's payments and reverse its registration.
     *
     * Authorization: only the payment owner may cancel
     *
     * @param paymentId Payment ID
     * @param request Optional body with a cancellation reason
     * @return Cancellation details
     */
    @PostMapping("/payments/{paymentId}/cancel")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CancelResponse> cancelPayment(
            @PathVariable Long paymentId,
            @Valid @RequestBody(required = false) CancelRequest request
    ) {
        String userId = SecurityUtils.requireCurrentUserId();
        String reason = request != null ? request.getReason() : null;

        CancelResult result = registrationCoordinator.cancelPayment(userId, paymentId, reason);
        return ResponseEntity.ok(CancelResponse.fromResult(result));
    }

    /**
     * List the caller's payments, newest first.
     *
     * @param status Optional filter: "paid" or "cancelled"
     * @param kind Optional filter: "test" or "course"
     * @param from Optional first paid date (yyyy-MM-dd, inclusive)
     * @param to Optional last paid date (yyyy-MM-dd, inclusive)
     * @return Payment history
     */
    @GetMapping("/me/payments")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<PaymentResponse>> getMyPayments(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        String userId = SecurityUtils.requireCurrentUserId();
        OfferingKind offeringKind = kind == null || kind.isBlank() ? null : OfferingKind.fromCode(kind);

        List<PaymentResponse> payments = paymentHistoryService
                .getPaymentHistory(userId, parseStatus(status), offeringKind, from, to)
                .stream()
                .map(PaymentResponse::fromEntry)
                .collect(Collectors.toList());

        return ResponseEntity.ok(payments);
    }

    /**
     * Get one of the caller's payments.
     *
     * @param paymentId Payment ID
     * @return Payment details
     */
    @GetMapping("/me/payments/{paymentId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PaymentResponse> getMyPayment(@PathVariable Long paymentId) {
        String userId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(PaymentResponse.fromEntry(paymentHistoryService.getPayment(userId, paymentId)));
    }

    private static PaymentStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return PaymentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported payment status: " + status
                    + ". Supported: paid, cancelled", e);
        }
    }
}
