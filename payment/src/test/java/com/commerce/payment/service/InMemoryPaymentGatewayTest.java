package com.commerce.payment.service;

import com.commerce.shared.payment.PaymentAuthorization;
import com.commerce.shared.payment.PaymentCapture;
import com.commerce.shared.payment.PaymentDetails;
import com.commerce.shared.payment.PaymentRefund;
import com.commerce.shared.payment.PaymentRequest;
import com.commerce.shared.payment.PaymentTransaction;
import com.commerce.shared.payment.TransactionStatus;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class InMemoryPaymentGatewayTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final BigDecimal AMOUNT = new BigDecimal("1299.00");

    InMemoryPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryPaymentGateway(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static <R extends PaymentRequest> Task<R> task(R request) {
        return Task.of("sess_1", "cust_001", request);
    }

    private TaskResult<PaymentAuthorization> authorize(PaymentDetails details) {
        return gateway.authorize(task(new PaymentRequest.Authorize(AMOUNT, details)));
    }

    // ─── authorize ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("card — even last digit authorizes")
    void card_evenDigit_authorizes() {
        TaskResult<PaymentAuthorization> result = authorize(PaymentDetails.card("4111111111111112"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.payload().authId()).isEqualTo("auth_" + result.payload().txId());
        assertThat(result.payload().status()).isEqualTo(TransactionStatus.AUTHORIZED);
    }

    @Test
    @DisplayName("card — odd last digit is CARD_DECLINED")
    void card_oddDigit_declines() {
        TaskResult<PaymentAuthorization> result = authorize(PaymentDetails.card("4111111111111111"));

        assertThat(result.firstErrorCode()).contains(ErrorCodes.CARD_DECLINED);
        assertThat(result.nextActions()).extracting(NextAction::type).containsExactly(NextAction.Type.ASK_CUSTOMER);
    }

    @Test
    @DisplayName("card — last4 0000 is INSUFFICIENT_FUNDS")
    void card_0000_insufficientFunds() {
        assertThat(authorize(PaymentDetails.card("4111111111110000")).firstErrorCode())
                .contains(ErrorCodes.INSUFFICIENT_FUNDS);
    }

    @Test
    @DisplayName("card — short number is INVALID_CARD")
    void card_shortNumber_invalid() {
        assertThat(authorize(PaymentDetails.card("41112")).firstErrorCode()).contains(ErrorCodes.INVALID_CARD);
    }

    @Test
    @DisplayName("card — token is judged by its last four characters")
    void card_token() {
        assertThat(authorize(PaymentDetails.cardToken("tok_card_1112")).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("upi — valid id is pending with a collect request")
    void upi_pending() {
        TaskResult<PaymentAuthorization> result = authorize(PaymentDetails.upi("alice@okbank"));

        assertThat(result.isPending()).isTrue();
        assertThat(result.payload().status()).isEqualTo(TransactionStatus.PENDING);
        assertThat(result.nextActions()).singleElement()
                .extracting(NextAction::message).asString().contains("alice@okbank");
    }

    @Test
    @DisplayName("upi — missing @ is INVALID_UPI, 'fail' is UPI_FAILURE")
    void upi_failures() {
        assertThat(authorize(PaymentDetails.upi("alice")).firstErrorCode()).contains(ErrorCodes.INVALID_UPI);
        assertThat(authorize(PaymentDetails.upi("fail@okbank")).firstErrorCode()).contains(ErrorCodes.UPI_FAILURE);
    }

    @Test
    @DisplayName("gift card — balance must cover the amount")
    void giftCard_balance() {
        assertThat(authorize(PaymentDetails.giftCard("GC1", new BigDecimal("5000"))).isSuccess()).isTrue();
        assertThat(authorize(PaymentDetails.giftCard("GC2", new BigDecimal("10"))).firstErrorCode())
                .contains(ErrorCodes.INSUFFICIENT_GIFT_BALANCE);
    }

    @Test
    @DisplayName("pos — always authorizes")
    void pos_authorizes() {
        assertThat(authorize(PaymentDetails.pos(null)).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("non-positive amount is INVALID_AMOUNT")
    void invalidAmount() {
        TaskResult<PaymentAuthorization> result = gateway.authorize(
                task(new PaymentRequest.Authorize(BigDecimal.ZERO, PaymentDetails.pos("T1"))));

        assertThat(result.firstErrorCode()).contains(ErrorCodes.INVALID_AMOUNT);
    }

    @Test
    @DisplayName("missing method is UNSUPPORTED_METHOD")
    void missingMethod() {
        TaskResult<PaymentAuthorization> result = gateway.authorize(task(new PaymentRequest.Authorize(AMOUNT, null)));

        assertThat(result.firstErrorCode()).contains(ErrorCodes.UNSUPPORTED_METHOD);
    }

    // ─── capture ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("capture — captures once, second capture is an idempotent success")
    void capture_idempotent() {
        String authId = authorize(PaymentDetails.card("4111111111111112")).payload().authId();

        TaskResult<PaymentCapture> first = gateway.capture(task(new PaymentRequest.Capture(authId)));
        TaskResult<PaymentCapture> second = gateway.capture(task(new PaymentRequest.Capture(authId)));

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.payload().alreadyCaptured()).isFalse();
        assertThat(first.payload().transaction().status()).isEqualTo(TransactionStatus.CAPTURED);
        assertThat(first.payload().transaction().capturedAt()).isEqualTo(NOW);
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.payload().alreadyCaptured()).isTrue();
        assertThat(second.payload().captureId()).isEqualTo(first.payload().captureId());
    }

    @Test
    @DisplayName("capture — unknown auth id is AUTH_NOT_FOUND")
    void capture_unknownAuth() {
        assertThat(gateway.capture(task(new PaymentRequest.Capture("auth_nope"))).firstErrorCode())
                .contains(ErrorCodes.AUTH_NOT_FOUND);
    }

    // ─── refund / status ──────────────────────────────────────────────────────

    @Test
    @DisplayName("refund — defaults to the full amount and is visible in status")
    void refund_fullAmount() {
        PaymentAuthorization auth = authorize(PaymentDetails.card("4111111111111112")).payload();
        gateway.capture(task(new PaymentRequest.Capture(auth.authId())));

        TaskResult<PaymentRefund> refund = gateway.refund(task(new PaymentRequest.Refund(auth.txId(), null)));
        TaskResult<PaymentTransaction> status = gateway.status(task(new PaymentRequest.Status(null, auth.authId())));

        assertThat(refund.isSuccess()).isTrue();
        assertThat(refund.payload().amount()).isEqualByComparingTo(AMOUNT);
        assertThat(status.payload().refunds()).extracting(PaymentRefund::refundId)
                .containsExactly(refund.payload().refundId());
    }

    @Test
    @DisplayName("refund — pending transaction is REFUND_NOT_ALLOWED, unknown is TX_NOT_FOUND")
    void refund_rejections() {
        PaymentAuthorization pending = authorize(PaymentDetails.upi("bob@okbank")).payload();

        assertThat(gateway.refund(task(new PaymentRequest.Refund(pending.txId(), null))).firstErrorCode())
                .contains(ErrorCodes.REFUND_NOT_ALLOWED);
        assertThat(gateway.refund(task(new PaymentRequest.Refund("tx_nope", null))).firstErrorCode())
                .contains(ErrorCodes.TX_NOT_FOUND);
    }

    @Test
    @DisplayName("status — by tx id and unknown id")
    void status_lookup() {
        PaymentAuthorization auth = authorize(PaymentDetails.pos("T1")).payload();

        assertThat(gateway.status(task(new PaymentRequest.Status(auth.txId(), null))).payload().amount())
                .isEqualByComparingTo(AMOUNT);
        assertThat(gateway.status(task(new PaymentRequest.Status("tx_nope", null))).firstErrorCode())
                .contains(ErrorCodes.TX_NOT_FOUND);
    }
}
