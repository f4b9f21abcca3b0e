package com.flagship.storefront_payments.payment;

import com.flagship.storefront_payments.exception.ErrorCode;
import com.flagship.storefront_payments.exception.GatewayException;
import com.flagship.storefront_payments.exception.OrderAlreadyPaidException;
import com.flagship.storefront_payments.exception.OrderCancelledException;
import com.flagship.storefront_payments.exception.OrderNotFoundException;
import com.flagship.storefront_payments.exception.PaymentValidationException;
import com.flagship.storefront_payments.gateway.GatewayInitiation;
import com.flagship.storefront_payments.gateway.InitiateTransaction;
import com.flagship.storefront_payments.gateway.PaymentGatewayClient;
import com.flagship.storefront_payments.gateway.PaymentReferenceGenerator;
import com.flagship.storefront_payments.observability.PaymentMetrics;
import com.flagship.storefront_payments.order.InMemoryOrderStore;
import com.flagship.storefront_payments.order.Order;
import com.flagship.storefront_payments.order.OrderStatus;
import com.flagship.storefront_payments.order.PaymentStatus;
import com.flagship.storefront_payments.order.TestOrders;
import com.flagship.storefront_payments.outbox.OutboxService;
import com.flagship.storefront_payments.payment.event.PaymentFailedEvent;
import com.flagship.storefront_payments.payment.event.PaymentInitiatedEvent;
import com.flagship.storefront_payments.security.CallerIdentity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentInitiatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private OutboxService outboxService;

    private InMemoryOrderStore orderStore;
    private PaymentInitiator initiator;
    private CallerIdentity caller;

    @BeforeEach
    void setUp() {
        orderStore = new InMemoryOrderStore();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        PaymentMetrics metrics = new PaymentMetrics(new SimpleMeterRegistry());
        ReconciliationStateMachine stateMachine =
                new ReconciliationStateMachine(orderStore, outboxService, metrics, clock, "KES");
        initiator = new PaymentInitiator(orderStore, gatewayClient, new PaymentReferenceGenerator(clock),
                stateMachine, metrics, "KES");
        caller = new CallerIdentity(UUID.randomUUID(), "reader@example.com");
    }

    private static GatewayInitiation accepted(InitiateTransaction transaction) {
        return new GatewayInitiation("https://checkout.paystack.com/" + transaction.getReference(),
                "access-" + transaction.getReference(), transaction.getReference());
    }

    @Test
    @DisplayName("Initiation stores the reference and returns the checkout URL")
    void initiate_StoresReference() {
        Order order = orderStore.put(TestOrders.pending(caller.getUserId(), "ORD-1001"));
        when(gatewayClient.initiate(any())).thenAnswer(invocation -> accepted(invocation.getArgument(0)));
        when(gatewayClient.getName()).thenReturn("paystack");

        PaymentInitiation initiation = initiator.initiate(order.getId(), caller);

        String expectedReference = "ORD-1001-" + NOW.toEpochMilli();
        assertEquals(expectedReference, initiation.getPaymentReference());
        assertEquals("https://checkout.paystack.com/" + expectedReference, initiation.getAuthorizationUrl());
        assertEquals(PaymentStatus.PENDING, initiation.getPaymentStatus());

        ArgumentCaptor<InitiateTransaction> captor = ArgumentCaptor.forClass(InitiateTransaction.class);
        verify(gatewayClient).initiate(captor.capture());
        assertEquals(0, TestOrders.TOTAL.compareTo(captor.getValue().getAmount()));
        assertEquals("reader@example.com", captor.getValue().getEmail());
        assertEquals("KES", captor.getValue().getCurrency());
        assertEquals("ORD-1001", captor.getValue().getMetadata().get("order_number"));

        Order stored = orderStore.get(order.getId());
        assertEquals(expectedReference, stored.getPaymentReference());
        assertEquals("paystack", stored.getPaymentMethod());
        verify(outboxService).saveEvent(any(PaymentInitiatedEvent.class));
    }

    @Test
    @DisplayName("Already paid order is refused without calling the gateway")
    void initiate_AlreadyPaid() {
        Order paid = orderStore.put(TestOrders.withState(TestOrders.pending(caller.getUserId()),
                OrderStatus.COMPLETED, PaymentStatus.PAID, "ORD-1-1700000000000"));

        OrderAlreadyPaidException e = assertThrows(OrderAlreadyPaidException.class,
                () -> initiator.initiate(paid.getId(), caller));

        assertEquals(ErrorCode.ORDER_ALREADY_PAID, e.getErrorCode());
        verifyNoInteractions(gatewayClient, outboxService);
    }

    @Test
    @DisplayName("Paid takes precedence over cancelled")
    void initiate_PaidBeforeCancelled() {
        Order order = orderStore.put(TestOrders.withState(TestOrders.pending(caller.getUserId()),
                OrderStatus.CANCELLED, PaymentStatus.PAID, "ORD-1-1700000000000"));

        assertThrows(OrderAlreadyPaidException.class, () -> initiator.initiate(order.getId(), caller));
    }

    @Test
    @DisplayName("Cancelled order is refused without calling the gateway")
    void initiate_Cancelled() {
        Order order = orderStore.put(TestOrders.withState(TestOrders.pending(caller.getUserId()),
                OrderStatus.CANCELLED, PaymentStatus.PENDING, null));

        assertThrows(OrderCancelledException.class, () -> initiator.initiate(order.getId(), caller));
        verifyNoInteractions(gatewayClient);
    }

    @Test
    @DisplayName("Another user's order is reported as not found")
    void initiate_OtherUsersOrder() {
        Order order = orderStore.put(TestOrders.withState(TestOrders.pending(UUID.randomUUID()),
                OrderStatus.COMPLETED, PaymentStatus.PAID, "REF"));

        assertThrows(OrderNotFoundException.class, () -> initiator.initiate(order.getId(), caller));
        verifyNoInteractions(gatewayClient);
    }

    @Test
    @DisplayName("Caller without an email cannot open a transaction")
    void initiate_RequiresEmail() {
        Order order = orderStore.put(TestOrders.pending(caller.getUserId()));
        CallerIdentity noEmail = new CallerIdentity(caller.getUserId(), null);

        assertThrows(PaymentValidationException.class, () -> initiator.initiate(order.getId(), noEmail));
        verifyNoInteractions(gatewayClient);
    }

    @Test
    @DisplayName("Gateway refusal marks the payment failed and propagates as a gateway error")
    void initiate_GatewayErrorMarksFailed() {
        Order order = orderStore.put(TestOrders.pending(caller.getUserId()));
        when(gatewayClient.initiate(any())).thenThrow(new GatewayException("paystack", "Invalid key"));

        GatewayException e = assertThrows(GatewayException.class, () -> initiator.initiate(order.getId(), caller));

        assertEquals(ErrorCode.GATEWAY_ERROR, e.getErrorCode());
        assertEquals(PaymentStatus.FAILED, orderStore.get(order.getId()).getPaymentStatus());
        assertNull(orderStore.get(order.getId()).getPaymentReference());

        ArgumentCaptor<PaymentFailedEvent> captor = ArgumentCaptor.forClass(PaymentFailedEvent.class);
        verify(outboxService).saveEvent(captor.capture());
        assertEquals(PaymentFailedEvent.REASON_INITIATION_FAILED, captor.getValue().getFailureReason());
    }

    @Test
    @DisplayName("Payment confirmed while the gateway call was in flight is not overwritten")
    void initiate_ConcurrentPaymentWins() {
        Order order = orderStore.put(TestOrders.awaitingPayment(caller.getUserId(), "ORD-1-1600000000000"));
        when(gatewayClient.initiate(any())).thenAnswer(invocation -> {
            orderStore.markPaid(order.getId(), "ORD-1-1600000000000", NOW);
            return accepted(invocation.getArgument(0));
        });
        when(gatewayClient.getName()).thenReturn("paystack");

        assertThrows(OrderAlreadyPaidException.class, () -> initiator.initiate(order.getId(), caller));

        Order stored = orderStore.get(order.getId());
        assertEquals(PaymentStatus.PAID, stored.getPaymentStatus());
        assertEquals("ORD-1-1600000000000", stored.getPaymentReference());
        verifyNoInteractions(outboxService);
    }
}
