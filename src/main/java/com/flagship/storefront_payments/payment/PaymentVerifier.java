package com.flagship.storefront_payments.payment;

import com.flagship.storefront_payments.exception.OrderNotFoundException;
import com.flagship.storefront_payments.exception.PaymentValidationException;
import com.flagship.storefront_payments.gateway.GatewayVerification;
import com.flagship.storefront_payments.gateway.PaymentGatewayClient;
import com.flagship.storefront_payments.observability.CorrelationContext;
import com.flagship.storefront_payments.observability.PaymentMetrics;
import com.flagship.storefront_payments.order.Order;
import com.flagship.storefront_payments.order.OrderStore;
import com.flagship.storefront_payments.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reconciles an order with the gateway's verdict.
 *
 * Safe to call any number of times, from any trigger (customer redirect, manual retry,
 * webhook): settled orders are answered from the database, and everything else goes through
 * {@link ReconciliationStateMachine}, which commits at most one transition per order.
 * A gateway failure propagates without any write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentVerifier {

    private final OrderStore orderStore;
    private final PaymentGatewayClient gatewayClient;
    private final ReconciliationStateMachine stateMachine;
    private final PaymentMetrics paymentMetrics;

    /**
     * Verifies on behalf of a user. The order is looked up by {@code orderId} when given,
     * otherwise by {@code reference}, and must belong to the caller.
     */
    public PaymentVerification verify(UUID orderId, String reference, CallerIdentity caller) {
        if (orderId == null && isBlank(reference)) {
            throw new PaymentValidationException("Payment reference or order ID is required");
        }

        long startTime = System.currentTimeMillis();
        try {
            Order order = orderId != null
                    ? orderStore.findOwnedById(orderId, caller.getUserId())
                        .orElseThrow(() -> new OrderNotFoundException(orderId.toString()))
                    : orderStore.findOwnedByReference(reference, caller.getUserId())
                        .orElseThrow(() -> new OrderNotFoundException(reference));

            MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, order.getId().toString());
            return reconcile(order, reference);

        } finally {
            paymentMetrics.recordOperationLatency("verify", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    /**
     * Verifies with a service identity, for gateway webhooks. There is no ownership scope;
     * the reference alone identifies the order.
     *
     * @return empty if no order carries this reference
     */
    public Optional<PaymentVerification> reconcileAsService(String reference) {
        if (isBlank(reference)) {
            throw new PaymentValidationException("Payment reference is required");
        }

        Optional<Order> order = orderStore.findByReference(reference);
        if (order.isEmpty()) {
            log.warn("No order carries payment reference {}", reference);
            return Optional.empty();
        }

        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, order.get().getId().toString());
        try {
            return Optional.of(reconcile(order.get(), reference));
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    /**
     * Read-only view of an owned order's payment state. Never calls the gateway.
     */
    public Order getOrderPayment(UUID orderId, CallerIdentity caller) {
        return orderStore.findOwnedById(orderId, caller.getUserId())
                .orElseThrow(() -> new OrderNotFoundException(orderId.toString()));
    }

    private PaymentVerification reconcile(Order order, String suppliedReference) {
        if (order.isSettled()) {
            log.info("Order {} already {}; returning stored result", order.getOrderNumber(),
                    order.getPaymentStatus().getValue());
            paymentMetrics.recordVerification(ReconciliationOutcome.ALREADY_SETTLED.name());
            return PaymentVerification.settled(order);
        }

        String reference = !isBlank(suppliedReference) ? suppliedReference : order.getPaymentReference();
        if (isBlank(reference)) {
            Map<String, String> details = new LinkedHashMap<>();
            details.put("order_id", order.getId().toString());
            details.put("order_number", order.getOrderNumber());
            details.put("payment_status", order.getPaymentStatus().getValue());
            throw new PaymentValidationException("No payment reference found", details);
        }
        if (order.getPaymentReference() != null && !reference.equals(order.getPaymentReference())) {
            log.warn("Verifying reference {} for order {} whose current reference is {}",
                    reference, order.getOrderNumber(), order.getPaymentReference());
        }

        GatewayVerification verification = gatewayClient.verify(reference);

        ReconciliationResult result = paymentMetrics.timeReconciliation(
                () -> stateMachine.apply(order, reference, verification));

        Order current = orderStore.findById(order.getId())
                .orElseThrow(() -> new OrderNotFoundException(order.getId().toString()));

        if (result.lostRace()) {
            if (current.isSettled()) {
                log.info("Order {} was settled by a concurrent reconciliation", order.getOrderNumber());
                paymentMetrics.recordVerification(ReconciliationOutcome.ALREADY_SETTLED.name());
                return PaymentVerification.settled(current);
            }
            log.warn("Verdict {} for order {} not applied; payment status is {}",
                    result.getOutcome(), order.getOrderNumber(), current.getPaymentStatus().getValue());
        }

        paymentMetrics.recordVerification(result.getOutcome().name());
        return PaymentVerification.of(current, reference, verification, result.getOutcome());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
