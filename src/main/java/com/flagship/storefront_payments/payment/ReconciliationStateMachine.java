package com.flagship.storefront_payments.payment;

import com.flagship.storefront_payments.gateway.GatewayVerification;
import com.flagship.storefront_payments.gateway.MinorUnits;
import com.flagship.storefront_payments.order.Order;
import com.flagship.storefront_payments.order.OrderStore;
import com.flagship.storefront_payments.observability.PaymentMetrics;
import com.flagship.storefront_payments.outbox.OutboxService;
import com.flagship.storefront_payments.payment.event.OrderPaidEvent;
import com.flagship.storefront_payments.payment.event.PaymentFailedEvent;
import com.flagship.storefront_payments.payment.event.PaymentInitiatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * The single place where an order's payment status changes.
 *
 * Every transition is one guarded write in {@link OrderStore} plus, when the write wins,
 * one outbox event in the same transaction. Concurrent reconciliations of the same order
 * therefore commit at most one transition and publish at most one event; the losers see
 * {@link ReconciliationResult#lostRace()} and re-read.
 *
 * Transactions here are short: gateway calls happen before these methods are entered.
 */
@Service
@Slf4j
public class ReconciliationStateMachine {

    private final OrderStore orderStore;
    private final OutboxService outboxService;
    private final PaymentMetrics paymentMetrics;
    private final Clock clock;
    private final String expectedCurrency;

    public ReconciliationStateMachine(OrderStore orderStore,
                                      OutboxService outboxService,
                                      PaymentMetrics paymentMetrics,
                                      Clock clock,
                                      @Value("${paystack.currency:KES}") String expectedCurrency) {
        this.orderStore = orderStore;
        this.outboxService = outboxService;
        this.paymentMetrics = paymentMetrics;
        this.clock = clock;
        this.expectedCurrency = expectedCurrency;
    }

    /**
     * Maps a verdict to an outcome without touching any state.
     */
    public ReconciliationOutcome decide(Order order, GatewayVerification verification) {
        if (order.isSettled()) {
            return ReconciliationOutcome.ALREADY_SETTLED;
        }

        return switch (verification.getStatus()) {
            case SUCCESS -> matchesOrder(order, verification)
                    ? ReconciliationOutcome.PAID
                    : ReconciliationOutcome.AMOUNT_MISMATCH;
            case FAILED, ABANDONED -> ReconciliationOutcome.FAILED;
            case PENDING, REVERSED, UNKNOWN -> ReconciliationOutcome.STILL_PENDING;
        };
    }

    /**
     * Commits the outcome of a verdict for {@code reference}. The write only applies while the
     * order is still PENDING under that same reference.
     */
    @Transactional
    public ReconciliationResult apply(Order order, String reference, GatewayVerification verification) {
        ReconciliationOutcome outcome = decide(order, verification);
        Instant now = clock.instant();

        return switch (outcome) {
            case PAID -> applyPaid(order, reference, verification, now);
            case AMOUNT_MISMATCH -> {
                log.error("Gateway amount mismatch for order {}: expected {} {} (minor {}), gateway reported {} {} (minor {})",
                        order.getOrderNumber(),
                        order.getTotalPrice(), expectedCurrency, MinorUnits.toMinor(order.getTotalPrice()),
                        verification.getAmountMajorUnits(), verification.getCurrency(),
                        verification.getAmountMinorUnits());
                yield applyFailed(order, reference, PaymentFailedEvent.REASON_AMOUNT_MISMATCH, outcome, now);
            }
            case FAILED -> applyFailed(order, reference, failureReason(verification), outcome, now);
            case STILL_PENDING, ALREADY_SETTLED -> {
                log.debug("No transition for order {}: outcome={}, gatewayStatus={}",
                        order.getOrderNumber(), outcome, verification.getRawStatus());
                yield new ReconciliationResult(outcome, false);
            }
        };
    }

    /**
     * Stores a freshly opened gateway transaction. Fails (returns false) if, since the caller's
     * precondition read, the order was paid, refunded or cancelled.
     */
    @Transactional
    public boolean recordInitiation(Order order, UUID userId, String reference, String method, String currency) {
        Instant now = clock.instant();
        boolean recorded = orderStore.recordInitiation(order.getId(), userId, reference, method, now);
        if (recorded) {
            outboxService.saveEvent(PaymentInitiatedEvent.of(order, reference, method, currency, now));
            log.info("Payment initiated for order {}: reference={}", order.getOrderNumber(), reference);
        } else {
            paymentMetrics.recordCasConflict("initiation");
            log.warn("Initiation of order {} lost to a concurrent change", order.getOrderNumber());
        }
        return recorded;
    }

    /**
     * Marks the payment FAILED after the gateway refused to open a transaction.
     * A paid order is left untouched.
     */
    @Transactional
    public boolean recordInitiationFailure(Order order, UUID userId) {
        Instant now = clock.instant();
        boolean recorded = orderStore.markInitiationFailed(order.getId(), userId, now);
        if (recorded) {
            outboxService.saveEvent(PaymentFailedEvent.of(order, order.getPaymentReference(),
                    PaymentFailedEvent.REASON_INITIATION_FAILED, now));
            paymentMetrics.recordPaymentFailed(PaymentFailedEvent.REASON_INITIATION_FAILED);
        }
        return recorded;
    }

    private ReconciliationResult applyPaid(Order order, String reference,
                                           GatewayVerification verification, Instant now) {
        boolean won = orderStore.markPaid(order.getId(), reference, now);
        if (won) {
            outboxService.saveEvent(OrderPaidEvent.of(order, reference, verification, now));
            paymentMetrics.incrementPaymentsPaid();
            log.info("Order {} paid: reference={}, amount={} {}, channel={}",
                    order.getOrderNumber(), reference, verification.getAmountMajorUnits(),
                    verification.getCurrency(), verification.getChannel());
        } else {
            paymentMetrics.recordCasConflict("pending_to_paid");
            log.info("Order {} was not pending under reference {}; paid transition skipped",
                    order.getOrderNumber(), reference);
        }
        return new ReconciliationResult(ReconciliationOutcome.PAID, won);
    }

    private ReconciliationResult applyFailed(Order order, String reference, String reason,
                                             ReconciliationOutcome outcome, Instant now) {
        boolean won = orderStore.markPaymentFailed(order.getId(), reference, now);
        if (won) {
            outboxService.saveEvent(PaymentFailedEvent.of(order, reference, reason, now));
            paymentMetrics.recordPaymentFailed(reason);
            log.info("Order {} payment failed: reference={}, reason={}", order.getOrderNumber(), reference, reason);
        } else {
            paymentMetrics.recordCasConflict("pending_to_failed");
            log.info("Order {} was not pending under reference {}; failed transition skipped",
                    order.getOrderNumber(), reference);
        }
        return new ReconciliationResult(outcome, won);
    }

    private boolean matchesOrder(Order order, GatewayVerification verification) {
        boolean amountMatches = verification.getAmountMinorUnits() == MinorUnits.toMinor(order.getTotalPrice());
        boolean currencyMatches = verification.getCurrency() == null
                || verification.getCurrency().equalsIgnoreCase(expectedCurrency);
        return amountMatches && currencyMatches;
    }

    private String failureReason(GatewayVerification verification) {
        return verification.getRawStatus() != null
                ? verification.getRawStatus().toLowerCase(Locale.ROOT)
                : verification.getStatus().name().toLowerCase(Locale.ROOT);
    }
}
