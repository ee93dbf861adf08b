package com.commerce.shared.fulfillment;

import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;

/**
 * Turns a paid order into a shipping or pickup record.
 */
public interface FulfillmentService {

    TaskResult<FulfillmentRecord> create(Task<FulfillmentRequest.Create> task);

    TaskResult<FulfillmentRecord> updateStatus(Task<FulfillmentRequest.UpdateStatus> task);

    TaskResult<FulfillmentRecord> cancel(Task<FulfillmentRequest.Cancel> task);

    TaskResult<FulfillmentRecord> get(Task<FulfillmentRequest.Get> task);
}
