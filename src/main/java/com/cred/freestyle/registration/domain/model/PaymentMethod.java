package com.cred.freestyle.registration.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Supported payment methods and their per-method rules.
 * Each method knows its accepted amount range, its processing fee rate and how it
 * labels the external transaction reference.
 *
 * @author Registration Team
 */
public enum PaymentMethod {

    KAKAOPAY("kakaopay", "KAKAO", "kakaopay",
            new BigDecimal("100"), new BigDecimal("50000000"), new BigDecimal("0.029"), false),

    CARD("card", "CARD", "card_pg",
            new BigDecimal("1000"), new BigDecimal("100000000"), new BigDecimal("0.032"), true),

    BANK_TRANSFER("bank_transfer", "BANK", "bank_transfer",
            new BigDecimal("1000"), new BigDecimal("200000000"), new BigDecimal("0.005"), false);

    private final String code;
    private final String transactionPrefix;
    private final String gateway;
    private final BigDecimal minAmount;
    private final BigDecimal maxAmount;
    private final BigDecimal feeRate;
    private final boolean supportsInstallment;

    PaymentMethod(String code, String transactionPrefix, String gateway,
                  BigDecimal minAmount, BigDecimal maxAmount, BigDecimal feeRate,
                  boolean supportsInstallment) {
        this.code = code;
        this.transactionPrefix = transactionPrefix;
        this.gateway = gateway;
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
        this.feeRate = feeRate;
        this.supportsInstallment = supportsInstallment;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public BigDecimal getMinAmount() {
        return minAmount;
    }

    public BigDecimal getMaxAmount() {
        return maxAmount;
    }

    public BigDecimal getFeeRate() {
        return feeRate;
    }

    /**
     * Check the amount against this method's accepted range (inclusive).
     *
     * @param amount Requested amount
     * @return true if the method can carry the amount
     */
    public boolean accepts(BigDecimal amount) {
        return amount != null
                && amount.compareTo(minAmount) >= 0
                && amount.compareTo(maxAmount) <= 0;
    }

    /**
     * Default external transaction reference, e.g. {@code CARD_user-1_42}.
     */
    public String externalTransactionId(String userId, Long offeringId) {
        return transactionPrefix + "_" + userId + "_" + offeringId;
    }

    /**
     * Gateway metadata returned alongside a successful payment.
     *
     * @param amount Paid amount
     * @return Ordered metadata map
     */
    public Map<String, Object> transactionMetadata(BigDecimal amount) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("paymentGateway", gateway);
        metadata.put("supportsRefund", true);
        if (supportsInstallment) {
            metadata.put("supportsInstallment", true);
        }
        metadata.put("processingFeeRate", feeRate);
        metadata.put("estimatedFee", amount.multiply(feeRate).setScale(2, RoundingMode.HALF_UP));
        return metadata;
    }

    /**
     * Resolve a payment method from its code.
     *
     * @param code Method code ("kakaopay", "card", "bank_transfer")
     * @return Matching method
     * @throws IllegalArgumentException if the method is not supported
     */
    public static PaymentMethod fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (PaymentMethod method : values()) {
                if (method.code.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported payment method: " + code
                + ". Supported: " + supportedCodes());
    }

    public static List<String> supportedCodes() {
        return Arrays.stream(values()).map(PaymentMethod::getCode).collect(Collectors.toList());
    }
}
