package com.commerce.checkout.saga;

/**
 * Which failures unwind the compensation stack.
 */
public enum CompensationMode {

    /**
     * Only a failed authorization releases the reservation. Capture and
     * fulfillment failures leave stock held and ask for manual intervention.
     */
    PAYMENT_ONLY {
        @Override
        public boolean compensates(FailureReason reason) {
            return reason == FailureReason.PAYMENT_FAILED;
        }
    },

    /** Every failure unwinds whatever the completed steps pushed. */
    FULL {
        @Override
        public boolean compensates(FailureReason reason) {
            return true;
        }
    };

    public abstract boolean compensates(FailureReason reason);
}
