package com.flagship.storefront_payments.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.storefront_payments.exception.GatewayException;
import com.flagship.storefront_payments.exception.OrderNotFoundException;
import com.flagship.storefront_payments.exception.PaymentValidationException;
import com.flagship.storefront_payments.gateway.GatewayInitiation;
import com.flagship.storefront_payments.gateway.GatewayVerification;
import com.flagship.storefront_payments.gateway.InitiateTransaction;
import com.flagship.storefront_payments.gateway.PaymentGatewayClient;
import com.flagship.storefront_payments.gateway.PaymentReferenceGenerator;
import com.flagship.storefront_payments.gateway.TransactionStatus;
import com.flagship.storefront_payments.gateway.paystack.PaystackApi;
import com.flagship.storefront_payments.gateway.paystack.PaystackGatewayClient;
import com.flagship.storefront_payments.gateway.paystack.PaystackResponse;
import com.flagship.storefront_payments.gateway.paystack.TransactionData;
import com.flagship.storefront_payments.observability.PaymentMetrics;
import com.flagship.storefront_payments.order.InMemoryOrderStore;
import com.flagship.storefront_payments.order.Order;
import com.flagship.storefront_payments.order.OrderStatus;
import com.flagship.storefront_payments.order.PaymentStatus;
import com.flagship.storefront_payments.order.TestOrders;
import com.flagship.storefront_payments.outbox.OutboxService;
import com.flagship.storefront_payments.payment.dto.VerifyPaymentResponse;
import com.flagship.storefront_payments.payment.event.OrderPaidEvent;
import com.flagship.storefront_payments.security.CallerIdentity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentVerifierTest {

    private static final String REFERENCE = "ORD-1001-1700000000000";

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private OutboxService outboxService;

    private InMemoryOrderStore orderStore;
    private PaymentMetrics metrics;
    private ReconciliationStateMachine stateMachine;
    private PaymentVerifier verifier;
    private CallerIdentity caller;

    @BeforeEach
    void setUp() {
        orderStore = new InMemoryOrderStore();
        metrics = new PaymentMetrics(new SimpleMeterRegistry());
        stateMachine = new ReconciliationStateMachine(orderStore, outboxService, metrics, Clock.systemUTC(), "KES");
        verifier = new PaymentVerifier(orderStore, gatewayClient, stateMachine, metrics);
        caller = new CallerIdentity(UUID.randomUUID(), "reader@example.com");
    }

    private static GatewayVerification verdict(TransactionStatus status, String raw, long amount) {
        return GatewayVerification.builder()
                .reference(REFERENCE)
                .status(status)
                .rawStatus(raw)
                .amountMinorUnits(amount)
                .currency("KES")
                .paidAt(status == TransactionStatus.SUCCESS ? Instant.now() : null)
                .channel("card")
                .build();
    }

    private Order awaitingPayment() {
        return orderStore.put(TestOrders.awaitingPayment(caller.getUserId(), REFERENCE));
    }

    @Test
    @DisplayName("Successful payment of 1500.00 KES (150000 minor) pays and completes the order")
    void verify_SuccessPaysOrder() {
        Order order = awaitingPayment();
        when(gatewayClient.verify(REFERENCE)).thenReturn(verdict(TransactionStatus.SUCCESS, "success", 150000L));

        PaymentVerification result = verifier.verify(null, REFERENCE, caller);

        assertEquals(PaymentStatus.PAID, result.getPaymentStatus());
        assertEquals(OrderStatus.COMPLETED, result.getOrderStatus());
        assertEquals("success", result.getTransactionStatus());
        assertEquals(0, TestOrders.TOTAL.compareTo(result.getAmount()));
        assertFalse(result.isStillPending());
        assertEquals(PaymentStatus.PAID, orderStore.get(order.getId()).getPaymentStatus());
    }

    @Test
    @DisplayName("Verifying a paid order again answers from the database")
    void verify_IsIdempotent() {
        Order order = awaitingPayment();
        when(gatewayClient.verify(REFERENCE)).thenReturn(verdict(TransactionStatus.SUCCESS, "success", 150000L));

        PaymentVerification first = verifier.verify(order.getId(), null, caller);
        PaymentVerification second = verifier.verify(order.getId(), null, caller);
        PaymentVerification third = verifier.verify(null, REFERENCE, caller);

        assertEquals(PaymentStatus.PAID, first.getPaymentStatus());
        assertEquals(PaymentStatus.PAID, second.getPaymentStatus());
        assertEquals(ReconciliationOutcome.ALREADY_SETTLED, second.getOutcome());
        assertEquals("success", third.getTransactionStatus());
        assertEquals(VerifyPaymentResponse.from(second), VerifyPaymentResponse.from(third));
        assertEquals(VerifyPaymentResponse.from(second),
                VerifyPaymentResponse.from(verifier.verify(order.getId(), REFERENCE, caller)));
        verify(gatewayClient, times(1)).verify(anyString());
        verify(outboxService, times(1)).saveEvent(any(OrderPaidEvent.class));
        assertEquals(1, orderStore.successfulWrites());
    }

    @Test
    @DisplayName("Abandoned payment fails, order stays pending, and can be re-initiated with a new reference")
    void verify_AbandonedThenReinitiate() {
        Order order = awaitingPayment();
        when(gatewayClient.verify(REFERENCE)).thenReturn(verdict(TransactionStatus.ABANDONED, "abandoned", 150000L));

        PaymentVerification result = verifier.verify(order.getId(), REFERENCE, caller);

        assertEquals(PaymentStatus.FAILED, result.getPaymentStatus());
        assertEquals(OrderStatus.PENDING, result.getOrderStatus());

        when(gatewayClient.initiate(any())).thenAnswer(invocation ->
                new GatewayInitiation("https://checkout.paystack.com/x", "x",
                        invocation.<InitiateTransaction>getArgument(0).getReference()));
        when(gatewayClient.getName()).thenReturn("paystack");
        PaymentInitiator initiator = new PaymentInitiator(orderStore, gatewayClient,
                new PaymentReferenceGenerator(Clock.systemUTC()), stateMachine, metrics, "KES");

        PaymentInitiation retry = initiator.initiate(order.getId(), caller);

        assertNotEquals(REFERENCE, retry.getPaymentReference());
        Order stored = orderStore.get(order.getId());
        assertEquals(PaymentStatus.PENDING, stored.getPaymentStatus());
        assertEquals(retry.getPaymentReference(), stored.getPaymentReference());
    }

    @Test
    @DisplayName("Unreachable gateway surfaces as a gateway error and changes nothing")
    void verify_GatewayUnreachable() {
        Order order = awaitingPayment();
        when(gatewayClient.verify(REFERENCE)).thenThrow(
                new GatewayException("paystack", "Payment gateway unreachable", true, null));

        GatewayException e = assertThrows(GatewayException.class, () -> verifier.verify(order.getId(), null, caller));

        assertTrue(e.isUnreachable());
        assertEquals(PaymentStatus.PENDING, orderStore.get(order.getId()).getPaymentStatus());
        assertEquals(0, orderStore.successfulWrites());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("A Paystack success without an amount is a gateway error and writes nothing")
    void verify_SuccessWithoutAmountLeavesOrderPending() {
        Order order = awaitingPayment();
        PaystackApi paystackApi = mock(PaystackApi.class);
        when(paystackApi.verify(REFERENCE)).thenReturn(new PaystackResponse<>(true, "Verification successful",
                new TransactionData(42L, "success", REFERENCE, null, "KES", Instant.now(), "card", null, "Approved")));
        PaystackGatewayClient paystack = new PaystackGatewayClient(paystackApi, new ObjectMapper(), metrics,
                "sk_test_secret", "", List.of("card"));
        PaymentVerifier paystackVerifier = new PaymentVerifier(orderStore, paystack, stateMachine, metrics);

        assertThrows(GatewayException.class, () -> paystackVerifier.verify(order.getId(), null, caller));

        assertEquals(PaymentStatus.PENDING, orderStore.get(order.getId()).getPaymentStatus());
        assertEquals(0, orderStore.successfulWrites());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("Pending gateway verdict leaves the order pending and says so")
    void verify_StillPending() {
        Order order = awaitingPayment();
        when(gatewayClient.verify(REFERENCE)).thenReturn(verdict(TransactionStatus.PENDING, "ongoing", 150000L));

        PaymentVerification result = verifier.verify(order.getId(), null, caller);

        assertTrue(result.isStillPending());
        assertEquals(PaymentStatus.PENDING, result.getPaymentStatus());
    }

    @Test
    @DisplayName("Another user's order is not found, by id or by reference")
    void verify_CrossTenantIsNotFound() {
        Order order = awaitingPayment();
        CallerIdentity stranger = new CallerIdentity(UUID.randomUUID(), "other@example.com");

        assertThrows(OrderNotFoundException.class, () -> verifier.verify(order.getId(), null, stranger));
        assertThrows(OrderNotFoundException.class, () -> verifier.verify(null, REFERENCE, stranger));
        assertThrows(OrderNotFoundException.class, () -> verifier.getOrderPayment(order.getId(), stranger));
        verifyNoInteractions(gatewayClient);
    }

    @Test
    @DisplayName("Either a reference or an order id is required")
    void verify_RequiresReferenceOrOrderId() {
        assertThrows(PaymentValidationException.class, () -> verifier.verify(null, " ", caller));
    }

    @Test
    @DisplayName("Order that was never initiated has no reference to verify")
    void verify_NoReferenceStored() {
        Order order = orderStore.put(TestOrders.pending(caller.getUserId()));

        PaymentValidationException e = assertThrows(PaymentValidationException.class,
                () -> verifier.verify(order.getId(), null, caller));

        assertEquals(order.getOrderNumber(), e.getDetails().get("order_number"));
        verifyNoInteractions(gatewayClient);
    }

    @Test
    @DisplayName("Webhook reconciliation finds the order by reference alone")
    void reconcileAsService_ByReference() {
        awaitingPayment();
        when(gatewayClient.verify(REFERENCE)).thenReturn(verdict(TransactionStatus.SUCCESS, "success", 150000L));

        assertEquals(PaymentStatus.PAID, verifier.reconcileAsService(REFERENCE).orElseThrow().getPaymentStatus());
        assertTrue(verifier.reconcileAsService("UNKNOWN-REF").isEmpty());
    }

    @Test
    @DisplayName("Concurrent verifications of one order commit a single transition")
    void verify_ConcurrentCallsSingleTransition() throws Exception {
        Order order = awaitingPayment();
        when(gatewayClient.verify(REFERENCE)).thenReturn(verdict(TransactionStatus.SUCCESS, "success", 150000L));

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<PaymentVerification> results = Collections.synchronizedList(new ArrayList<>());
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    results.add(verifier.verify(order.getId(), REFERENCE, caller));
                } catch (Throwable t) {
                    errors.add(t);
                }
            });
        }

        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertTrue(errors.isEmpty(), () -> "Unexpected errors: " + errors);
        assertEquals(threads, results.size());
        results.forEach(result -> assertEquals(PaymentStatus.PAID, result.getPaymentStatus()));
        assertEquals(1, orderStore.successfulWrites());
        verify(outboxService, times(1)).saveEvent(any(OrderPaidEvent.class));
    }
}
