package com.commerce.checkout.demo;

import com.commerce.checkout.model.CartLine;
import com.commerce.checkout.model.CheckoutRequest;
import com.commerce.checkout.model.CheckoutResult;
import com.commerce.checkout.saga.CheckoutSaga;
import com.commerce.shared.json.TaskEnvelopeMapper;
import com.commerce.shared.model.Address;
import com.commerce.shared.payment.PaymentDetails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs three sample checkouts at startup and logs their wire output:
 * a paid order, a declined card and an out-of-stock cart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "checkout.demo.enabled", havingValue = "true")
public class DemoCheckoutRunner implements CommandLineRunner {

    private final CheckoutSaga checkoutSaga;
    private final TaskEnvelopeMapper envelopeMapper;

    @Override
    public void run(String... args) {
        Address bangalore = new Address("12 MG Road", "Bangalore", "560001");

        print("paid order", checkoutSaga.checkout(CheckoutRequest.builder()
                .sessionId("sess_demo_1")
                .customerId("cust_001")
                .cart(List.of(CartLine.of("TSHIRT-RED-XL", 1, "799")))
                .payment(PaymentDetails.card("4111111111111112"))
                .address(bangalore)
                .preferredLocation("STORE_1")
                .build()));

        print("declined card", checkoutSaga.checkout(CheckoutRequest.builder()
                .sessionId("sess_demo_2")
                .customerId("cust_002")
                .cart(List.of(CartLine.of("JEANS-BLK-32", 1, "1999")))
                .payment(PaymentDetails.card("4111111111111111"))
                .address(bangalore)
                .build()));

        print("out of stock", checkoutSaga.checkout(CheckoutRequest.builder()
                .sessionId("sess_demo_3")
                .customerId("cust_001")
                .cart(List.of(CartLine.of("TSHIRT-BLUE-M", 1, "699")))
                .payment(PaymentDetails.card("4111111111111112"))
                .address(bangalore)
                .build()));
    }

    private void print(String label, CheckoutResult result) {
        log.info("Demo checkout [{}]:\n{}", label, envelopeMapper.toJson(result.toWire()));
    }
}
