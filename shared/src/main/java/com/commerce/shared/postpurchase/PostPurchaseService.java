package com.commerce.shared.postpurchase;

import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;

/**
 * After-sale support: returns, feedback and warranty lookups for orders the
 * checkout has completed.
 */
public interface PostPurchaseService {

    TaskResult<PurchaseRecord> recordPurchase(Task<PostPurchaseRequest.RecordPurchase> task);

    TaskResult<ReturnRecord> initiateReturn(Task<PostPurchaseRequest.InitiateReturn> task);

    TaskResult<ReturnRecord> returnStatus(Task<PostPurchaseRequest.ReturnStatus> task);

    TaskResult<FeedbackReceipt> submitFeedback(Task<PostPurchaseRequest.SubmitFeedback> task);

    TaskResult<WarrantyStatus> checkWarranty(Task<PostPurchaseRequest.CheckWarranty> task);
}
