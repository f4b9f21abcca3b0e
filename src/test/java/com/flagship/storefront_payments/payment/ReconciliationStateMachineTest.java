package com.flagship.storefront_payments.payment;

import com.flagship.storefront_payments.gateway.GatewayVerification;
import com.flagship.storefront_payments.gateway.TransactionStatus;
import com.flagship.storefront_payments.observability.PaymentMetrics;
import com.flagship.storefront_payments.order.InMemoryOrderStore;
import com.flagship.storefront_payments.order.Order;
import com.flagship.storefront_payments.order.OrderStatus;
import com.flagship.storefront_payments.order.PaymentStatus;
import com.flagship.storefront_payments.order.TestOrders;
import com.flagship.storefront_payments.outbox.OutboxService;
import com.flagship.storefront_payments.payment.event.OrderPaidEvent;
import com.flagship.storefront_payments.payment.event.PaymentFailedEvent;
import com.flagship.storefront_payments.payment.event.PaymentInitiatedEvent;
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
class ReconciliationStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final String REFERENCE = "ORD-1001-1700000000000";

    @Mock
    private OutboxService outboxService;

    private InMemoryOrderStore orderStore;
    private SimpleMeterRegistry registry;
    private ReconciliationStateMachine stateMachine;
    private UUID userId;

    @BeforeEach
    void setUp() {
        orderStore = new InMemoryOrderStore();
        registry = new SimpleMeterRegistry();
        stateMachine = new ReconciliationStateMachine(orderStore, outboxService, new PaymentMetrics(registry),
                Clock.fixed(NOW, ZoneOffset.UTC), "KES");
        userId = UUID.randomUUID();
    }

    private static GatewayVerification verdict(TransactionStatus status, String raw, long amount, String currency) {
        return GatewayVerification.builder()
                .reference(REFERENCE)
                .status(status)
                .rawStatus(raw)
                .amountMinorUnits(amount)
                .currency(currency)
                .paidAt(NOW)
                .channel("card")
                .build();
    }

    private Order awaitingPayment() {
        return orderStore.put(TestOrders.awaitingPayment(userId, REFERENCE));
    }

    @Test
    @DisplayName("Outcome table for a pending order")
    void decide_OutcomeTable() {
        Order order = awaitingPayment();

        assertEquals(ReconciliationOutcome.PAID,
                stateMachine.decide(order, verdict(TransactionStatus.SUCCESS, "success", 150000L, "KES")));
        assertEquals(ReconciliationOutcome.PAID,
                stateMachine.decide(order, verdict(TransactionStatus.SUCCESS, "success", 150000L, null)));
        assertEquals(ReconciliationOutcome.AMOUNT_MISMATCH,
                stateMachine.decide(order, verdict(TransactionStatus.SUCCESS, "success", 100L, "KES")));
        assertEquals(ReconciliationOutcome.AMOUNT_MISMATCH,
                stateMachine.decide(order, verdict(TransactionStatus.SUCCESS, "success", 150000L, "NGN")));
        assertEquals(ReconciliationOutcome.FAILED,
                stateMachine.decide(order, verdict(TransactionStatus.FAILED, "failed", 150000L, "KES")));
        assertEquals(ReconciliationOutcome.FAILED,
                stateMachine.decide(order, verdict(TransactionStatus.ABANDONED, "abandoned", 150000L, "KES")));
        assertEquals(ReconciliationOutcome.STILL_PENDING,
                stateMachine.decide(order, verdict(TransactionStatus.PENDING, "ongoing", 150000L, "KES")));
        assertEquals(ReconciliationOutcome.STILL_PENDING,
                stateMachine.decide(order, verdict(TransactionStatus.UNKNOWN, "weird", 150000L, "KES")));
    }

    @Test
    @DisplayName("Settled orders never change, whatever the gateway says")
    void decide_SettledOrderIsTerminal() {
        Order paid = orderStore.put(TestOrders.withState(TestOrders.pending(userId),
                OrderStatus.COMPLETED, PaymentStatus.PAID, REFERENCE));

        ReconciliationResult result = stateMachine.apply(paid, REFERENCE,
                verdict(TransactionStatus.FAILED, "failed", 150000L, "KES"));

        assertEquals(ReconciliationOutcome.ALREADY_SETTLED, result.getOutcome());
        assertFalse(result.isApplied());
        assertFalse(result.lostRace());
        assertEquals(PaymentStatus.PAID, orderStore.get(paid.getId()).getPaymentStatus());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("Success with matching amount pays and completes the order and writes OrderPaid")
    void apply_SuccessPaysOrder() {
        Order order = awaitingPayment();

        ReconciliationResult result = stateMachine.apply(order, REFERENCE,
                verdict(TransactionStatus.SUCCESS, "success", 150000L, "KES"));

        assertTrue(result.isApplied());
        Order stored = orderStore.get(order.getId());
        assertEquals(PaymentStatus.PAID, stored.getPaymentStatus());
        assertEquals(OrderStatus.COMPLETED, stored.getStatus());
        assertEquals(NOW, stored.getCompletedAt());
        verify(outboxService).saveEvent(any(OrderPaidEvent.class));
        assertEquals(1.0, registry.counter("payments.paid").count());
    }

    @Test
    @DisplayName("Amount mismatch fails the payment with reason amount_mismatch")
    void apply_AmountMismatchFailsPayment() {
        Order order = awaitingPayment();

        ReconciliationResult result = stateMachine.apply(order, REFERENCE,
                verdict(TransactionStatus.SUCCESS, "success", 149999L, "KES"));

        assertEquals(ReconciliationOutcome.AMOUNT_MISMATCH, result.getOutcome());
        assertEquals(PaymentStatus.FAILED, orderStore.get(order.getId()).getPaymentStatus());

        ArgumentCaptor<PaymentFailedEvent> captor = ArgumentCaptor.forClass(PaymentFailedEvent.class);
        verify(outboxService).saveEvent(captor.capture());
        assertEquals(PaymentFailedEvent.REASON_AMOUNT_MISMATCH, captor.getValue().getFailureReason());
    }

    @Test
    @DisplayName("Abandoned fails the payment but leaves the order pending")
    void apply_AbandonedLeavesOrderPending() {
        Order order = awaitingPayment();

        stateMachine.apply(order, REFERENCE, verdict(TransactionStatus.ABANDONED, "abandoned", 150000L, "KES"));

        Order stored = orderStore.get(order.getId());
        assertEquals(PaymentStatus.FAILED, stored.getPaymentStatus());
        assertEquals(OrderStatus.PENDING, stored.getStatus());

        ArgumentCaptor<PaymentFailedEvent> captor = ArgumentCaptor.forClass(PaymentFailedEvent.class);
        verify(outboxService).saveEvent(captor.capture());
        assertEquals("abandoned", captor.getValue().getFailureReason());
    }

    @Test
    @DisplayName("Pending verdict writes nothing")
    void apply_PendingWritesNothing() {
        Order order = awaitingPayment();

        ReconciliationResult result = stateMachine.apply(order, REFERENCE,
                verdict(TransactionStatus.PENDING, "ongoing", 0L, "KES"));

        assertEquals(ReconciliationOutcome.STILL_PENDING, result.getOutcome());
        assertEquals(0, orderStore.successfulWrites());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("A verdict for a superseded reference loses the guarded write")
    void apply_StaleReferenceLosesRace() {
        Order order = awaitingPayment();

        ReconciliationResult result = stateMachine.apply(order, "ORD-1001-1600000000000",
                verdict(TransactionStatus.SUCCESS, "success", 150000L, "KES"));

        assertTrue(result.lostRace());
        assertEquals(PaymentStatus.PENDING, orderStore.get(order.getId()).getPaymentStatus());
        verifyNoInteractions(outboxService);
        assertEquals(1.0, registry.counter("payments.cas.conflicts", "transition", "pending_to_paid").count());
    }

    @Test
    @DisplayName("Recording an initiation writes PaymentInitiated; a paid order refuses it")
    void recordInitiation_GuardedAgainstSettledOrders() {
        Order order = orderStore.put(TestOrders.pending(userId));

        assertTrue(stateMachine.recordInitiation(order, userId, REFERENCE, "paystack", "KES"));
        assertEquals(REFERENCE, orderStore.get(order.getId()).getPaymentReference());
        verify(outboxService).saveEvent(any(PaymentInitiatedEvent.class));

        Order paid = orderStore.put(TestOrders.withState(order, OrderStatus.COMPLETED, PaymentStatus.PAID, REFERENCE));
        assertFalse(stateMachine.recordInitiation(paid, userId, "ORD-1001-1800000000000", "paystack", "KES"));
        assertEquals(REFERENCE, orderStore.get(order.getId()).getPaymentReference());
    }
}
