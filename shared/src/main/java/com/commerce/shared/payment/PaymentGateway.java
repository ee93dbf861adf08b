package com.commerce.shared.payment;

import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;

/**
 * Authorizes and captures funds.
 *
 * Contract:
 *  - authorize: success or pending carry an {@code authId}; failure carries error details
 *  - capture:   success or failure only; capturing twice succeeds without charging twice
 *  - refund:    allowed for AUTHORIZED and CAPTURED transactions
 */
public interface PaymentGateway {

    TaskResult<PaymentAuthorization> authorize(Task<PaymentRequest.Authorize> task);

    TaskResult<PaymentCapture> capture(Task<PaymentRequest.Capture> task);

    TaskResult<PaymentRefund> refund(Task<PaymentRequest.Refund> task);

    TaskResult<PaymentTransaction> status(Task<PaymentRequest.Status> task);
}
