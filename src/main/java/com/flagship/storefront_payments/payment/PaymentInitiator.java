package com.flagship.storefront_payments.payment;

import com.flagship.storefront_payments.exception.GatewayException;
import com.flagship.storefront_payments.exception.OrderAlreadyPaidException;
import com.flagship.storefront_payments.exception.OrderCancelledException;
import com.flagship.storefront_payments.exception.OrderNotFoundException;
import com.flagship.storefront_payments.exception.OrderStoreException;
import com.flagship.storefront_payments.exception.PaymentException;
import com.flagship.storefront_payments.exception.PaymentValidationException;
import com.flagship.storefront_payments.gateway.GatewayInitiation;
import com.flagship.storefront_payments.gateway.InitiateTransaction;
import com.flagship.storefront_payments.gateway.PaymentGatewayClient;
import com.flagship.storefront_payments.gateway.PaymentReferenceGenerator;
import com.flagship.storefront_payments.observability.CorrelationContext;
import com.flagship.storefront_payments.observability.PaymentMetrics;
import com.flagship.storefront_payments.order.Order;
import com.flagship.storefront_payments.order.OrderStore;
import com.flagship.storefront_payments.order.PaymentStatus;
import com.flagship.storefront_payments.security.CallerIdentity;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Opens a gateway transaction for an order and records its reference.
 *
 * Preconditions are checked in order and the first failure wins:
 * the order exists and is owned by the caller, it is not paid, it is not cancelled.
 * The reference is only written after the gateway accepted the transaction, and that
 * write re-checks the same preconditions, so a payment confirmed in the meantime
 * is never overwritten.
 */
@Service
@Slf4j
public class PaymentInitiator {

    private final OrderStore orderStore;
    private final PaymentGatewayClient gatewayClient;
    private final PaymentReferenceGenerator referenceGenerator;
    private final ReconciliationStateMachine stateMachine;
    private final PaymentMetrics paymentMetrics;
    private final String currency;

    public PaymentInitiator(OrderStore orderStore,
                            PaymentGatewayClient gatewayClient,
                            PaymentReferenceGenerator referenceGenerator,
                            ReconciliationStateMachine stateMachine,
                            PaymentMetrics paymentMetrics,
                            @Value("${paystack.currency:KES}") String currency) {
        this.orderStore = orderStore;
        this.gatewayClient = gatewayClient;
        this.referenceGenerator = referenceGenerator;
        this.stateMachine = stateMachine;
        this.paymentMetrics = paymentMetrics;
        this.currency = currency;
    }

    public PaymentInitiation initiate(UUID orderId, CallerIdentity caller) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, orderId.toString());

        try {
            Order order = orderStore.findOwnedById(orderId, caller.getUserId())
                    .orElseThrow(() -> new OrderNotFoundException(orderId.toString()));
            checkPayable(order);

            if (!caller.hasEmail()) {
                throw new PaymentValidationException("An email address is required to pay for an order");
            }

            String reference = referenceGenerator.generate(order.getOrderNumber());
            InitiateTransaction transaction = InitiateTransaction.builder()
                    .email(caller.getEmail())
                    .amount(order.getTotalPrice())
                    .currency(currency)
                    .reference(reference)
                    .metadata(metadataFor(order))
                    .build();

            GatewayInitiation initiation;
            try {
                initiation = gatewayClient.initiate(transaction);
            } catch (GatewayException e) {
                recordFailure(order, caller, e);
                paymentMetrics.recordInitiation("gateway_error");
                throw e;
            }

            String storedReference = initiation.getReference() != null ? initiation.getReference() : reference;
            if (!stateMachine.recordInitiation(order, caller.getUserId(), storedReference,
                    gatewayClient.getName(), currency)) {
                Order current = orderStore.findOwnedById(orderId, caller.getUserId())
                        .orElseThrow(() -> new OrderNotFoundException(orderId.toString()));
                checkPayable(current);
                throw new OrderStoreException("Order " + order.getOrderNumber() + " changed while initiating payment", null);
            }

            paymentMetrics.recordInitiation("success");
            log.info("Payment initiation completed: order={}, reference={}, duration={}ms",
                    order.getOrderNumber(), storedReference, System.currentTimeMillis() - startTime);

            return PaymentInitiation.builder()
                    .orderId(order.getId())
                    .orderNumber(order.getOrderNumber())
                    .paymentReference(storedReference)
                    .authorizationUrl(initiation.getAuthorizationUrl())
                    .accessCode(initiation.getAccessCode())
                    .paymentStatus(PaymentStatus.PENDING)
                    .build();

        } catch (GatewayException e) {
            throw e;
        } catch (PaymentException e) {
            paymentMetrics.recordInitiation(e.getErrorCode().name());
            throw e;
        } finally {
            paymentMetrics.recordOperationLatency("initiate", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    private void checkPayable(Order order) {
        if (order.isSettled()) {
            throw new OrderAlreadyPaidException(order);
        }
        if (order.isCancelled()) {
            throw new OrderCancelledException(order);
        }
    }

    /**
     * Best effort: a store failure here must not hide the gateway error from the caller.
     */
    private void recordFailure(Order order, CallerIdentity caller, GatewayException cause) {
        try {
            stateMachine.recordInitiationFailure(order, caller.getUserId());
        } catch (PaymentException storeError) {
            log.error("Could not record failed initiation for order {}: {}",
                    order.getOrderNumber(), storeError.getMessage());
            cause.addSuppressed(storeError);
        }
    }

    private Map<String, Object> metadataFor(Order order) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("order_id", order.getId().toString());
        metadata.put("order_number", order.getOrderNumber());
        metadata.put("user_id", order.getUserId().toString());
        metadata.put("subtotal", order.getSubTotal());
        metadata.put("tax", order.getTax());
        metadata.put("shipping", order.getShipping());
        metadata.put("discount", order.getDiscount());
        return metadata;
    }
}
