package com.cred.freestyle.registration.api.controller;

import com.cred.freestyle.registration.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.registration.config.SecurityConfig;
import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.OfferingRef;
import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.domain.model.PaymentMethod;
import com.cred.freestyle.registration.domain.model.Registration;
import com.cred.freestyle.registration.exception.AlreadyRegisteredException;
import com.cred.freestyle.registration.exception.ConcurrentRequestException;
import com.cred.freestyle.registration.exception.EligibilityException;
import com.cred.freestyle.registration.exception.ErrorKind;
import com.cred.freestyle.registration.exception.InvalidStateException;
import com.cred.freestyle.registration.exception.ResourceNotFoundException;
import com.cred.freestyle.registration.exception.ServiceUnavailableException;
import com.cred.freestyle.registration.security.HeaderAuthenticationFilter;
import com.cred.freestyle.registration.service.ApplyResult;
import com.cred.freestyle.registration.service.RegistrationCoordinator;
import com.cred.freestyle.registration.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for RegistrationController using MockMvc.
 * Tests HTTP layer in isolation with a mocked coordinator.
 */
@WebMvcTest(RegistrationController.class)
@ContextConfiguration(classes = {RegistrationController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("RegistrationController Tests")
class RegistrationControllerTest {

    private static final String USER_ID = "user-1";
    private static final BigDecimal PRICE = new BigDecimal("45000.00");

    private static final String CARD_BODY = """
            {
                "amount": "45000.00",
                "paymentMethod": "card"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RegistrationCoordinator registrationCoordinator;

    private static ApplyResult applyResult(OfferingKind kind, Long offeringId) {
        Payment payment = TestDataBuilder.payment().id(7L).userId(USER_ID).target(kind, offeringId).build();
        Registration registration = TestDataBuilder.registration().id(9L).userId(USER_ID)
                .offering(kind, offeringId).build();
        return new ApplyResult(payment, registration);
    }

    // ========================================
    // POST /api/v1/tests/{id}/apply Tests
    // ========================================

    @Test
    @DisplayName("POST /tests/{id}/apply - Valid request returns 201 Created")
    void applyToTest_ValidRequest_Returns201() throws Exception {
        when(registrationCoordinator.apply(USER_ID, OfferingRef.test(1L), PRICE, PaymentMethod.CARD))
                .thenReturn(applyResult(OfferingKind.TEST, 1L));

        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.paymentId").value(7))
                .andExpect(jsonPath("$.registrationId").value(9))
                .andExpect(jsonPath("$.offeringKind").value("test"))
                .andExpect(jsonPath("$.offeringId").value(1))
                .andExpect(jsonPath("$.paymentMethod").value("card"))
                .andExpect(jsonPath("$.registrationStatus").value("ACTIVE"))
                .andExpect(jsonPath("$.externalTransactionId").value("CARD_user-1_1"))
                .andExpect(jsonPath("$.transactionMetadata.paymentGateway").value("card_pg"));
    }

    @Test
    @DisplayName("POST /courses/{id}/enroll - Routes to the course offering")
    void enrollInCourse_ValidRequest_Returns201() throws Exception {
        when(registrationCoordinator.apply(eq(USER_ID), eq(OfferingRef.course(5L)), eq(PRICE), eq(PaymentMethod.KAKAOPAY)))
                .thenReturn(applyResult(OfferingKind.COURSE, 5L));

        mockMvc.perform(post("/api/v1/courses/5/enroll")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 45000.00, \"payment_method\": \"kakaopay\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.offeringKind").value("course"))
                .andExpect(jsonPath("$.offeringId").value(5));

        verify(registrationCoordinator).apply(USER_ID, OfferingRef.course(5L), PRICE, PaymentMethod.KAKAOPAY);
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Missing identity returns 401")
    void applyToTest_NoUser_Returns401() throws Exception {
        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(registrationCoordinator);
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Missing amount returns 400 with field errors")
    void applyToTest_MissingAmount_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentMethod\": \"card\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.amount").exists());

        verifyNoInteractions(registrationCoordinator);
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Non-decimal amount returns 400")
    void applyToTest_MalformedAmount_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": \"forty\", \"paymentMethod\": \"card\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(registrationCoordinator);
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Unsupported payment method returns 400")
    void applyToTest_UnsupportedMethod_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": \"45000.00\", \"paymentMethod\": \"bitcoin\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("bitcoin")));

        verifyNoInteractions(registrationCoordinator);
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Price mismatch returns 400 with kind")
    void applyToTest_PriceMismatch_Returns400() throws Exception {
        when(registrationCoordinator.apply(any(), any(), any(), any()))
                .thenThrow(new EligibilityException(ErrorKind.PRICE_MISMATCH, OfferingRef.test(1L), "mismatch"));

        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.kind").value("PRICE_MISMATCH"))
                .andExpect(jsonPath("$.details.offeringKind").value("test"));
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Outside window returns 400 with kind")
    void applyToTest_OutsideWindow_Returns400() throws Exception {
        when(registrationCoordinator.apply(any(), any(), any(), any()))
                .thenThrow(new EligibilityException(ErrorKind.OUTSIDE_WINDOW, OfferingRef.test(1L), "closed"));

        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.kind").value("OUTSIDE_WINDOW"));
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Already registered returns 400")
    void applyToTest_AlreadyRegistered_Returns400() throws Exception {
        when(registrationCoordinator.apply(any(), any(), any(), any()))
                .thenThrow(new AlreadyRegisteredException(USER_ID, OfferingRef.test(1L)));

        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.kind").value("ALREADY_REGISTERED"));
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Unknown test returns 404")
    void applyToTest_NotFound_Returns404() throws Exception {
        when(registrationCoordinator.apply(any(), any(), any(), any()))
                .thenThrow(new ResourceNotFoundException("Test", "99"));

        mockMvc.perform(post("/api/v1/tests/99/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.kind").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Lock busy returns 409")
    void applyToTest_LockBusy_Returns409() throws Exception {
        when(registrationCoordinator.apply(any(), any(), any(), any()))
                .thenThrow(new ConcurrentRequestException("lock:registration:user-1:test:1"));

        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.kind").value("CONFLICT"));
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Database unavailable returns 503")
    void applyToTest_Unavailable_Returns503() throws Exception {
        when(registrationCoordinator.apply(any(), any(), any(), any()))
                .thenThrow(new ServiceUnavailableException("Service temporarily unavailable. Please retry later",
                        new RuntimeException("connection refused")));

        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.details.kind").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.message").value(not(containsString("connection refused"))));
    }

    @Test
    @DisplayName("POST /tests/{id}/apply - Unexpected failure returns generic 500")
    void applyToTest_Unexpected_Returns500() throws Exception {
        when(registrationCoordinator.apply(any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("jdbc:postgresql://internal-host"));

        mockMvc.perform(post("/api/v1/tests/1/apply")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value(not(containsString("internal-host"))));
    }

    // ========================================
    // POST /api/v1/{kind}/{id}/complete Tests
    // ========================================

    @Test
    @DisplayName("POST /tests/{id}/complete - Returns 200 with completed registration")
    void completeTest_Returns200() throws Exception {
        Registration completed = TestDataBuilder.registration().id(9L).userId(USER_ID)
                .offering(OfferingKind.TEST, 1L).completed().build();
        when(registrationCoordinator.complete(USER_ID, OfferingRef.test(1L))).thenReturn(completed);

        mockMvc.perform(post("/api/v1/tests/1/complete")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.registrationId").value(9))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.completedAt").exists());
    }

    @Test
    @WithMockUser(username = "mock-user")
    @DisplayName("POST /courses/{id}/complete - Non-header principal resolves by name")
    void completeCourse_MockUser_UsesPrincipalName() throws Exception {
        Registration completed = TestDataBuilder.registration().id(3L).userId("mock-user")
                .offering(OfferingKind.COURSE, 5L).completed().build();
        when(registrationCoordinator.complete("mock-user", OfferingRef.course(5L))).thenReturn(completed);

        mockMvc.perform(post("/api/v1/courses/5/complete"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.offeringKind").value("course"));

        verify(registrationCoordinator).complete("mock-user", OfferingRef.course(5L));
    }

    @Test
    @DisplayName("POST /courses/{id}/complete - Already completed returns 400")
    void completeCourse_AlreadyCompleted_Returns400() throws Exception {
        when(registrationCoordinator.complete(USER_ID, OfferingRef.course(5L)))
                .thenThrow(new InvalidStateException(ErrorKind.ALREADY_COMPLETED, "Registration", 9L, "done"));

        mockMvc.perform(post("/api/v1/courses/5/complete")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.kind").value("ALREADY_COMPLETED"));
    }

    @Test
    @DisplayName("POST /tests/{id}/complete - Non-numeric id returns 400")
    void completeTest_BadId_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/tests/abc/complete")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(registrationCoordinator);
    }
}
