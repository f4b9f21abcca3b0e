package com.flagship.storefront_payments.gateway.paystack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.storefront_payments.exception.GatewayException;
import com.flagship.storefront_payments.gateway.GatewayInitiation;
import com.flagship.storefront_payments.gateway.GatewayVerification;
import com.flagship.storefront_payments.gateway.InitiateTransaction;
import com.flagship.storefront_payments.gateway.MinorUnits;
import com.flagship.storefront_payments.gateway.PaymentGatewayClient;
import com.flagship.storefront_payments.gateway.TransactionStatus;
import com.flagship.storefront_payments.observability.PaymentMetrics;
import feign.FeignException;
import feign.RetryableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link PaymentGatewayClient} backed by the Paystack API.
 *
 * Failure mapping:
 * - timeouts and I/O errors: {@link GatewayException} flagged unreachable
 * - HTTP error statuses: {@link GatewayException} with Paystack's message when the body has one
 * - {@code status: false} or a missing {@code data}: {@link GatewayException} with Paystack's message
 * - a verification without an amount: {@link GatewayException}, so nothing is reconciled against it
 */
@Component
@Slf4j
public class PaystackGatewayClient implements PaymentGatewayClient {

    public static final String NAME = "paystack";

    private final PaystackApi paystackApi;
    private final ObjectMapper objectMapper;
    private final PaymentMetrics paymentMetrics;
    private final String secretKey;
    private final String callbackUrl;
    private final List<String> channels;

    public PaystackGatewayClient(PaystackApi paystackApi,
                                 ObjectMapper objectMapper,
                                 PaymentMetrics paymentMetrics,
                                 @Value("${paystack.secret-key:}") String secretKey,
                                 @Value("${paystack.callback-url:}") String callbackUrl,
                                 @Value("${paystack.channels:card,bank,ussd,qr,mobile_money,bank_transfer}")
                                 List<String> channels) {
        this.paystackApi = paystackApi;
        this.objectMapper = objectMapper;
        this.paymentMetrics = paymentMetrics;
        this.secretKey = secretKey;
        this.callbackUrl = callbackUrl;
        this.channels = channels;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public GatewayInitiation initiate(InitiateTransaction transaction) {
        requireSecretKey();

        InitializeTransactionRequest request = new InitializeTransactionRequest(
                transaction.getEmail(),
                MinorUnits.toMinor(transaction.getAmount()),
                transaction.getCurrency(),
                transaction.getReference(),
                callbackUrl.isBlank() ? null : callbackUrl,
                channels,
                withCustomFields(transaction.getMetadata())
        );

        log.info("Initializing Paystack transaction: reference={}, amountMinor={}, currency={}",
                request.reference(), request.amount(), request.currency());

        PaystackResponse<InitializeTransactionData> response =
                call("initialize", () -> paystackApi.initialize(request));

        InitializeTransactionData data = response.data();
        return new GatewayInitiation(
                data.authorizationUrl(),
                data.accessCode(),
                data.reference() != null ? data.reference() : transaction.getReference()
        );
    }

    @Override
    public GatewayVerification verify(String reference) {
        requireSecretKey();
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Reference is required for verification");
        }

        log.info("Verifying Paystack transaction: reference={}", reference);

        PaystackResponse<TransactionData> response = call("verify", () -> paystackApi.verify(reference));

        TransactionData data = response.data();
        TransactionStatus status = TransactionStatus.fromGateway(data.status());
        log.info("Paystack verdict: reference={}, status={}, amountMinor={}, currency={}",
                reference, data.status(), data.amount(), data.currency());
        if (data.amount() == null) {
            log.error("Paystack verification for {} carried no amount", reference);
            throw new GatewayException(NAME, "Paystack verification returned no amount");
        }

        return GatewayVerification.builder()
                .reference(data.reference() != null ? data.reference() : reference)
                .status(status)
                .rawStatus(data.status())
                .amountMinorUnits(data.amount())
                .currency(data.currency())
                .paidAt(data.paidAt())
                .channel(data.channel())
                .feesMinorUnits(data.fees())
                .gatewayMessage(data.gatewayResponse() != null ? data.gatewayResponse() : response.message())
                .build();
    }

    private <T> PaystackResponse<T> call(String operation, PaystackCall<T> call) {
        long start = System.currentTimeMillis();
        try {
            PaystackResponse<T> response = call.execute();
            if (response == null || !response.status() || response.data() == null) {
                String message = response != null && response.message() != null
                        ? response.message()
                        : "Paystack rejected the " + operation + " request";
                record(operation, "rejected", start);
                log.warn("Paystack {} rejected: {}", operation, message);
                throw new GatewayException(NAME, message);
            }
            record(operation, "success", start);
            return response;

        } catch (RetryableException e) {
            record(operation, "unreachable", start);
            log.error("Paystack {} unreachable: {}", operation, e.getMessage());
            throw new GatewayException(NAME, "Payment gateway unreachable", true, e);

        } catch (FeignException e) {
            record(operation, "http_" + e.status(), start);
            String message = extractMessage(e);
            log.error("Paystack {} failed: status={}, message={}", operation, e.status(), message);
            throw new GatewayException(NAME, message, e.status() < 0, e);
        }
    }

    private void record(String operation, String result, long start) {
        paymentMetrics.recordGatewayCall(NAME, operation, result, System.currentTimeMillis() - start);
    }

    private String extractMessage(FeignException e) {
        String body = e.contentUTF8();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode message = objectMapper.readTree(body).path("message");
                if (message.isTextual()) {
                    return message.asText();
                }
            } catch (Exception parseError) {
                log.debug("Paystack error body is not JSON: {}", parseError.getMessage());
            }
        }
        return "Payment gateway returned HTTP " + e.status();
    }

    /**
     * Paystack shows {@code custom_fields} on its dashboard and receipts.
     */
    private Map<String, Object> withCustomFields(Map<String, Object> metadata) {
        Map<String, Object> enriched = new LinkedHashMap<>();
        if (metadata != null) {
            enriched.putAll(metadata);
        }
        Object orderNumber = enriched.get("order_number");
        Object orderId = enriched.get("order_id");
        if (orderNumber != null && orderId != null) {
            enriched.put("custom_fields", List.of(
                    Map.of("display_name", "Order Number", "variable_name", "order_number",
                            "value", orderNumber.toString()),
                    Map.of("display_name", "Order ID", "variable_name", "order_id",
                            "value", orderId.toString())
            ));
        }
        return enriched;
    }

    private void requireSecretKey() {
        if (secretKey == null || secretKey.isBlank()) {
            throw new GatewayException(NAME, "Paystack secret key is not configured");
        }
    }

    @FunctionalInterface
    private interface PaystackCall<T> {
        PaystackResponse<T> execute();
    }
}
