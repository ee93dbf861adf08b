package com.commerce.checkout.config;

import com.commerce.checkout.saga.CheckoutSaga;
import com.commerce.checkout.saga.StepExecutor;
import com.commerce.fulfillment.service.InMemoryFulfillmentService;
import com.commerce.inventory.domain.StockEntry;
import com.commerce.inventory.ledger.InventoryLedger;
import com.commerce.inventory.repository.StockStore;
import com.commerce.inventory.service.InventoryService;
import com.commerce.inventory.service.LedgerAvailabilityLookup;
import com.commerce.loyalty.service.InMemoryLoyaltyService;
import com.commerce.notification.channels.NotificationChannel;
import com.commerce.notification.channels.impl.EmailChannel;
import com.commerce.notification.channels.impl.SmsChannel;
import com.commerce.notification.service.NotificationService;
import com.commerce.payment.service.InMemoryPaymentGateway;
import com.commerce.postpurchase.service.InMemoryPostPurchaseService;
import com.commerce.recommendation.catalog.ProductCatalog;
import com.commerce.recommendation.service.CatalogRecommendationService;
import com.commerce.shared.fulfillment.FulfillmentService;
import com.commerce.shared.json.JsonMappers;
import com.commerce.shared.json.TaskEnvelopeMapper;
import com.commerce.shared.loyalty.LoyaltyService;
import com.commerce.shared.notification.CustomerNotifier;
import com.commerce.shared.payment.PaymentGateway;
import com.commerce.shared.postpurchase.PostPurchaseService;
import com.commerce.shared.recommendation.RecommendationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Checkout Application Wiring
 *
 * Every collaborator is an in-process implementation behind its shared
 * interface; replacing one with a remote client only touches this class.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties({SagaProperties.class, InventoryProperties.class, CollaboratorProperties.class})
public class CheckoutConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ─── Inventory ────────────────────────────────────────────────────────────

    @Bean
    public StockStore stockStore(InventoryProperties properties) {
        List<StockEntry> seed = properties.getStock().entrySet().stream()
                .map(e -> StockEntry.of(e.getKey(), e.getValue()))
                .toList();
        log.info("Seeding stock ledger: skus={}", seed.size());
        return StockStore.seededWith(seed);
    }

    @Bean
    public InventoryLedger inventoryLedger(StockStore stockStore, Clock clock, InventoryProperties properties) {
        return new InventoryLedger(stockStore, clock, properties.getFallbackLocation());
    }

    @Bean
    public InventoryService inventoryService(InventoryLedger ledger, MeterRegistry meterRegistry,
                                             InventoryProperties properties) {
        return new InventoryService(ledger, meterRegistry, properties.getDefaultHold());
    }

    // ─── Collaborators ────────────────────────────────────────────────────────

    @Bean
    public PaymentGateway paymentGateway(Clock clock) {
        return new InMemoryPaymentGateway(clock);
    }

    @Bean
    public FulfillmentService fulfillmentService(Clock clock, CollaboratorProperties properties) {
        return new InMemoryFulfillmentService(clock, properties.getMetroCities(), properties.getStoreCapacity());
    }

    @Bean
    public LoyaltyService loyaltyService(CollaboratorProperties properties) {
        return new InMemoryLoyaltyService(properties.getLoyaltyBalances(), properties.getLoyaltyEarnRate());
    }

    @Bean
    public PostPurchaseService postPurchaseService(Clock clock, CollaboratorProperties properties) {
        return new InMemoryPostPurchaseService(clock, properties.getReturnWindowDays(), properties.getWarrantyDays());
    }

    @Bean
    public RecommendationService recommendationService(InventoryLedger ledger) {
        return new CatalogRecommendationService(ProductCatalog.demo(), new LedgerAvailabilityLookup(ledger));
    }

    @Bean
    public Map<String, NotificationChannel> notificationChannels(CollaboratorProperties collaborators) {
        return Map.of(CustomerNotifier.CHANNEL_EMAIL,
                new EmailChannel(collaborators.getCustomerEmails(), collaborators.getEmailDomain()),
                CustomerNotifier.CHANNEL_SMS,
                new SmsChannel(collaborators.getCustomerPhones(), collaborators.getSmsCountryCode()));
    }

    @Bean
    public CustomerNotifier customerNotifier(Map<String, NotificationChannel> notificationChannels) {
        return new NotificationService(notificationChannels);
    }

    // ─── Saga ─────────────────────────────────────────────────────────────────

    @Bean(destroyMethod = "shutdown")
    public ExecutorService checkoutStepExecutor(SagaProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutorThreads(),
                new CustomizableThreadFactory("checkout-step-"));
    }

    @Bean
    public StepExecutor stepExecutor(SagaProperties properties, ExecutorService checkoutStepExecutor) {
        return new StepExecutor(properties.getStepTimeout(), checkoutStepExecutor);
    }

    @Bean
    public CheckoutSaga checkoutSaga(InventoryService inventoryService,
                                     RecommendationService recommendationService,
                                     LoyaltyService loyaltyService,
                                     PaymentGateway paymentGateway,
                                     FulfillmentService fulfillmentService,
                                     PostPurchaseService postPurchaseService,
                                     CustomerNotifier customerNotifier,
                                     StepExecutor stepExecutor,
                                     SagaProperties properties,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        log.info("Checkout saga configured: stepTimeout={}, compensationMode={}",
                properties.getStepTimeout(), properties.getCompensationMode());
        return new CheckoutSaga(inventoryService, recommendationService, loyaltyService, paymentGateway,
                fulfillmentService, postPurchaseService, customerNotifier, stepExecutor, properties.getCompensationMode(),
                meterRegistry, clock);
    }

    // ─── Jackson ──────────────────────────────────────────────────────────────

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMappers.wire();
    }

    @Bean
    public TaskEnvelopeMapper taskEnvelopeMapper(ObjectMapper objectMapper) {
        return new TaskEnvelopeMapper(objectMapper);
    }
}
