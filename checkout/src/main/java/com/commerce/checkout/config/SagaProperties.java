package com.commerce.checkout.config;

import com.commerce.checkout.saga.CompensationMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Saga tuning.
 *
 * checkout:
 *   saga:
 *     step-timeout: 5s
 *     compensation-mode: payment_only
 *     executor-threads: 8
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "checkout.saga")
public class SagaProperties {

    /** Upper bound on any single collaborator call. */
    private Duration stepTimeout = Duration.ofSeconds(5);

    private CompensationMode compensationMode = CompensationMode.PAYMENT_ONLY;

    /** Threads available to run collaborator calls under the step timeout. */
    private int executorThreads = 8;
}
