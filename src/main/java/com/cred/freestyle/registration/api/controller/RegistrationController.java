package com.cred.freestyle.registration.api.controller;

import com.cred.freestyle.registration.api.dto.ApplyRequest;
import com.cred.freestyle.registration.api.dto.ApplyResponse;
import com.cred.freestyle.registration.api.dto.CompleteResponse;
import com.cred.freestyle.registration.domain.model.OfferingRef;
import com.cred.freestyle.registration.domain.model.PaymentMethod;
import com.cred.freestyle.registration.domain.model.Registration;
import com.cred.freestyle.registration.security.SecurityUtils;
import com.cred.freestyle.registration.service.ApplyResult;
import com.cred.freestyle.registration.service.RegistrationCoordinator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for test applications and course enrollments.
 * Both kinds share one flow; the path decides the offering kind.
 *
 * @author Registration Team
 */
@RestController
@RequestMapping("/api/v1")
public class RegistrationController {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationController.class);

    private final RegistrationCoordinator registrationCoordinator;

    public RegistrationController(RegistrationCoordinator registrationCoordinator) {
        this.registrationCoordinator = registrationCoordinator;
    }

    /**
     * Apply to a test by paying its price.
     *
     * @param testId Test ID
     * @param request Amount and payment method
     * @return 201 with the created payment and registration
     */
    @PostMapping("/tests/{testId}/apply")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApplyResponse> applyToTest(
            @PathVariable Long testId,
            @Valid @RequestBody ApplyRequest request
    ) {
        return register(OfferingRef.test(testId), request);
    }

    /**
     * Enroll in a course by paying its price.
     *
     * @param courseId Course ID
     * @param request Amount and payment method
     * @return 201 with the created payment and registration
     */
    @PostMapping("/courses/{courseId}/enroll")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApplyResponse> enrollInCourse(
            @PathVariable Long courseId,
            @Valid @RequestBody ApplyRequest request
    ) {
        return register(OfferingRef.course(courseId), request);
    }

    @PostMapping("/tests/{testId}/complete")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CompleteResponse> completeTest(@PathVariable Long testId) {
        return complete(OfferingRef.test(testId));
    }

    @PostMapping("/courses/{courseId}/complete")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CompleteResponse> completeCourse(@PathVariable Long courseId) {
        return complete(OfferingRef.course(courseId));
    }

    private ResponseEntity<ApplyResponse> register(OfferingRef ref, ApplyRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();
        PaymentMethod method = PaymentMethod.fromCode(request.getPaymentMethod());

        ApplyResult result = registrationCoordinator.apply(userId, ref, request.getAmount(), method);

        logger.debug("Registered user {} on {} with payment {}", userId, ref, result.getPayment().getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApplyResponse.fromResult(result));
    }

    private ResponseEntity<CompleteResponse> complete(OfferingRef ref) {
        String userId = SecurityUtils.requireCurrentUserId();
        Registration registration = registrationCoordinator.complete(userId, ref);
        return ResponseEntity.ok(CompleteResponse.fromEntity(registration));
    }
}
