package com.commerce.shared.payment;

import java.math.BigDecimal;

/**
 * Customer-supplied payment instrument. Only the fields relevant to
 * {@link #method()} are populated.
 */
public record PaymentDetails(PaymentMethod method,
                             String cardNumber,
                             String cardToken,
                             String upiId,
                             String giftCardCode,
                             BigDecimal giftCardBalance,
                             String terminalId) {

    public static PaymentDetails card(String cardNumber) {
        return new PaymentDetails(PaymentMethod.CARD, cardNumber, null, null, null, null, null);
    }

    public static PaymentDetails cardToken(String token) {
        return new PaymentDetails(PaymentMethod.CARD, null, token, null, null, null, null);
    }

    public static PaymentDetails upi(String upiId) {
        return new PaymentDetails(PaymentMethod.UPI, null, null, upiId, null, null, null);
    }

    public static PaymentDetails giftCard(String code, BigDecimal balance) {
        return new PaymentDetails(PaymentMethod.GIFT_CARD, null, null, null, code, balance, null);
    }

    public static PaymentDetails pos(String terminalId) {
        return new PaymentDetails(PaymentMethod.POS, null, null, null, null, null, terminalId);
    }
}
