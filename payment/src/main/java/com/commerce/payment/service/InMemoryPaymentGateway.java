package com.commerce.payment.service;

import com.commerce.payment.domain.Transaction;
import com.commerce.shared.payment.PaymentAuthorization;
import com.commerce.shared.payment.PaymentCapture;
import com.commerce.shared.payment.PaymentDetails;
import com.commerce.shared.payment.PaymentGateway;
import com.commerce.shared.payment.PaymentMethod;
import com.commerce.shared.payment.PaymentRefund;
import com.commerce.shared.payment.PaymentRequest;
import com.commerce.shared.payment.PaymentTransaction;
import com.commerce.shared.payment.TransactionStatus;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Reference payment gateway with deterministic demo rules.
 *
 * <ul>
 *   <li>card: number shorter than 12 digits is invalid, last4 {@code 0000} has
 *       insufficient funds, an even last digit approves, an odd one declines</li>
 *   <li>upi: id must contain {@code @}; one containing {@code fail} fails, any other
 *       gets a collect request and stays PENDING</li>
 *   <li>gift_card: authorizes when the balance covers the amount</li>
 *   <li>pos: always authorizes</li>
 * </ul>
 *
 * Capture is idempotent: capturing a captured transaction succeeds again
 * without a second charge.
 */
@Slf4j
public class InMemoryPaymentGateway implements PaymentGateway {

    static final BigDecimal DEFAULT_GIFT_CARD_BALANCE = new BigDecimal("1000");
    static final String DEFAULT_TERMINAL = "POS_1";

    private final ConcurrentMap<String, Transaction> transactions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> txIdByAuthId = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPaymentGateway(Clock clock) {
        this.clock = clock;
    }

    // ─── Authorize ────────────────────────────────────────────────────────────

    @Override
    public TaskResult<PaymentAuthorization> authorize(Task<PaymentRequest.Authorize> task) {
        BigDecimal amount = task.request().amount();
        PaymentDetails payment = task.request().payment();
        if (amount == null || amount.signum() <= 0) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.INVALID_AMOUNT, "Amount must be > 0", "amount", amount));
        }
        PaymentMethod method = payment == null ? null : payment.method();
        if (method == null) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.UNSUPPORTED_METHOD, "Payment method is required"),
                    NextAction.askCustomer("Supported methods: card, upi, gift_card, pos"));
        }
        switch (method) {
            case CARD:
                return authorizeCard(task, amount, payment);
            case UPI:
                return authorizeUpi(task, amount, payment);
            case GIFT_CARD:
                return authorizeGiftCard(task, amount, payment);
            case POS:
                String terminal = payment.terminalId() == null ? DEFAULT_TERMINAL : payment.terminalId();
                return approved(task, open(method, amount, TransactionStatus.AUTHORIZED, terminal));
            default:
                throw new IllegalStateException("Unhandled payment method " + method);
        }
    }

    private TaskResult<PaymentAuthorization> authorizeCard(Task<PaymentRequest.Authorize> task,
                                                           BigDecimal amount, PaymentDetails payment) {
        String number = payment.cardNumber();
        String token = payment.cardToken();
        if (number != null && !number.isEmpty() && number.length() < 12) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.INVALID_CARD, "Card number too short", "card_number", number),
                    NextAction.askCustomer("Please re-enter card details."));
        }
        String last4 = lastFour(number != null && !number.isEmpty() ? number : token);
        if ("0000".equals(last4)) {
            log.info("Card declined: reason=insufficient_funds, last4={}", last4);
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.INSUFFICIENT_FUNDS, "Card declined - insufficient funds", "last4", last4),
                    NextAction.askCustomer("Your card was declined. Would you like to try UPI or another card?"));
        }
        char lastDigit = last4.charAt(last4.length() - 1);
        boolean approve = !Character.isDigit(lastDigit) || Character.digit(lastDigit, 10) % 2 == 0;
        if (!approve) {
            log.info("Card declined: reason=issuer, last4={}", last4);
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.CARD_DECLINED, "Issuer declined the card", "last4", last4),
                    NextAction.askCustomer("Card was declined. Try another payment method?"));
        }
        return approved(task, open(PaymentMethod.CARD, amount, TransactionStatus.AUTHORIZED, last4));
    }

    private TaskResult<PaymentAuthorization> authorizeUpi(Task<PaymentRequest.Authorize> task,
                                                          BigDecimal amount, PaymentDetails payment) {
        String upiId = payment.upiId() == null ? "" : payment.upiId();
        if (!upiId.contains("@")) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.INVALID_UPI, "UPI id looks invalid", "upi_id", upiId),
                    NextAction.askCustomer("Please check the UPI ID."));
        }
        if (upiId.contains("fail")) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.UPI_FAILURE, "UPI collect failed", "upi_id", upiId),
                    NextAction.askCustomer("UPI failed. Try another method?"));
        }
        Transaction tx = open(PaymentMethod.UPI, amount, TransactionStatus.PENDING, upiId);
        log.info("UPI collect request sent: txId={}, upiId={}", tx.getTxId(), upiId);
        return TaskResult.pending(task, authorization(tx),
                List.of(NextAction.askCustomer("UPI collect request sent to " + upiId + ". Please approve to continue.")));
    }

    private TaskResult<PaymentAuthorization> authorizeGiftCard(Task<PaymentRequest.Authorize> task,
                                                               BigDecimal amount, PaymentDetails payment) {
        BigDecimal balance = payment.giftCardBalance() == null ? DEFAULT_GIFT_CARD_BALANCE : payment.giftCardBalance();
        if (balance.compareTo(amount) < 0) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.INSUFFICIENT_GIFT_BALANCE, "Gift card balance too low", "balance", balance),
                    NextAction.askCustomer("Gift card low. Pay remainder via another method?"));
        }
        return approved(task, open(PaymentMethod.GIFT_CARD, amount, TransactionStatus.AUTHORIZED, payment.giftCardCode()));
    }

    // ─── Capture / refund / status ────────────────────────────────────────────

    @Override
    public TaskResult<PaymentCapture> capture(Task<PaymentRequest.Capture> task) {
        String authId = task.request().authId();
        Optional<Transaction> found = byAuthId(authId);
        if (found.isEmpty()) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.AUTH_NOT_FOUND, "Authorization not found", "auth_id", authId));
        }
        Transaction tx = found.get();
        synchronized (tx) {
            if (tx.getStatus() == TransactionStatus.CAPTURED) {
                log.info("Capture skipped, already captured: txId={}", tx.getTxId());
                return TaskResult.success(task, new PaymentCapture("cap_" + tx.getTxId(), tx.toView(), true));
            }
            // a pending collect request counts as approved once capture is re-driven
            tx.setStatus(TransactionStatus.CAPTURED);
            tx.setCapturedAt(clock.instant());
            log.info("Payment captured: txId={}, amount={}", tx.getTxId(), tx.getAmount());
            return TaskResult.success(task, new PaymentCapture("cap_" + tx.getTxId(), tx.toView(), false));
        }
    }

    @Override
    public TaskResult<PaymentRefund> refund(Task<PaymentRequest.Refund> task) {
        String txId = task.request().txId();
        Transaction tx = txId == null ? null : transactions.get(txId);
        if (tx == null) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.TX_NOT_FOUND, "Transaction not found", "tx_id", txId));
        }
        synchronized (tx) {
            if (tx.getStatus() != TransactionStatus.CAPTURED && tx.getStatus() != TransactionStatus.AUTHORIZED) {
                return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.REFUND_NOT_ALLOWED,
                        "Cannot refund tx in status " + tx.getStatus(), "status", tx.getStatus()));
            }
            BigDecimal amount = task.request().amount() == null ? tx.getAmount() : task.request().amount();
            PaymentRefund refund = new PaymentRefund("ref_" + shortId(), txId, amount, clock.instant());
            tx.getRefunds().add(refund);
            log.info("Refund processed: refundId={}, txId={}, amount={}", refund.refundId(), txId, amount);
            return TaskResult.success(task, refund);
        }
    }

    @Override
    public TaskResult<PaymentTransaction> status(Task<PaymentRequest.Status> task) {
        PaymentRequest.Status request = task.request();
        Optional<Transaction> tx = request.txId() != null
                ? Optional.ofNullable(transactions.get(request.txId()))
                : byAuthId(request.authId());
        return tx.map(t -> TaskResult.success(task, t.toView()))
                .orElseGet(() -> TaskResult.failed(task, ErrorDetail.of(ErrorCodes.TX_NOT_FOUND, "Transaction not found")));
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private Transaction open(PaymentMethod method, BigDecimal amount, TransactionStatus status, String instrumentRef) {
        String txId = "tx_" + shortId();
        Transaction tx = Transaction.builder()
                .txId(txId)
                .authId("auth_" + txId)
                .method(method)
                .amount(amount)
                .status(status)
                .instrumentRef(instrumentRef)
                .createdAt(clock.instant())
                .build();
        transactions.put(txId, tx);
        txIdByAuthId.put(tx.getAuthId(), txId);
        return tx;
    }

    private TaskResult<PaymentAuthorization> approved(Task<PaymentRequest.Authorize> task, Transaction tx) {
        log.info("Payment authorized: txId={}, method={}, amount={}", tx.getTxId(), tx.getMethod(), tx.getAmount());
        return TaskResult.success(task, authorization(tx));
    }

    private static PaymentAuthorization authorization(Transaction tx) {
        return new PaymentAuthorization(tx.getTxId(), tx.getAuthId(), tx.getMethod(), tx.getAmount(), tx.getStatus());
    }

    private Optional<Transaction> byAuthId(String authId) {
        if (authId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(txIdByAuthId.get(authId)).map(transactions::get);
    }

    private static String lastFour(String value) {
        if (value == null || value.isEmpty()) {
            return "0000";
        }
        return value.length() <= 4 ? value : value.substring(value.length() - 4);
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
