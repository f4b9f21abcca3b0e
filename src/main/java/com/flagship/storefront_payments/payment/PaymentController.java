package com.flagship.storefront_payments.payment;

import com.flagship.storefront_payments.payment.dto.InitiatePaymentRequest;
import com.flagship.storefront_payments.payment.dto.InitiatePaymentResponse;
import com.flagship.storefront_payments.payment.dto.PaymentStatusResponse;
import com.flagship.storefront_payments.payment.dto.VerifyPaymentRequest;
import com.flagship.storefront_payments.payment.dto.VerifyPaymentResponse;
import com.flagship.storefront_payments.security.CallerIdentity;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.UUID;

/**
 * REST controller for order payments.
 *
 * Every endpoint except the gateway redirect requires a bearer token; the
 * {@link CallerIdentity} parameter is resolved before the body, so a missing token
 * answers 401 even when the body is also invalid.
 */
@RestController
@RequestMapping("/payments")
@Slf4j
public class PaymentController {

    private final PaymentInitiator paymentInitiator;
    private final PaymentVerifier paymentVerifier;
    private final String frontendUrl;

    public PaymentController(PaymentInitiator paymentInitiator,
                             PaymentVerifier paymentVerifier,
                             @Value("${storefront.frontend-url:http://localhost:5173}") String frontendUrl) {
        this.paymentInitiator = paymentInitiator;
        this.paymentVerifier = paymentVerifier;
        this.frontendUrl = frontendUrl;
    }

    /**
     * Opens a gateway transaction for the caller's order and returns the redirect URL.
     */
    @PostMapping("/initiate")
    public ResponseEntity<InitiatePaymentResponse> initiate(
            CallerIdentity caller,
            @Valid @RequestBody InitiatePaymentRequest request) {

        log.info("Payment initiation requested: orderId={}", request.orderId());
        PaymentInitiation initiation = paymentInitiator.initiate(request.orderId(), caller);
        return ResponseEntity.ok(InitiatePaymentResponse.from(initiation));
    }

    /**
     * Reconciles the caller's order with the gateway. Idempotent.
     */
    @PostMapping("/verify")
    public ResponseEntity<VerifyPaymentResponse> verify(
            CallerIdentity caller,
            @RequestBody VerifyPaymentRequest request) {

        log.info("Payment verification requested: orderId={}, reference={}",
                request.orderId(), request.reference());
        PaymentVerification verification = paymentVerifier.verify(request.orderId(), request.reference(), caller);
        return ResponseEntity.ok(VerifyPaymentResponse.from(verification));
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<PaymentStatusResponse> getPaymentStatus(
            CallerIdentity caller,
            @PathVariable("orderId") UUID orderId) {
        return ResponseEntity.ok(PaymentStatusResponse.from(paymentVerifier.getOrderPayment(orderId, caller)));
    }

    /**
     * Gateway redirect target after checkout. It changes nothing and ignores any status
     * parameter: the storefront confirmation page calls {@code /payments/verify} with the reference.
     */
    @GetMapping("/callback")
    public ResponseEntity<Void> callback(
            @RequestParam(name = "reference", required = false) String reference,
            @RequestParam(name = "trxref", required = false) String trxref) {

        String effectiveReference = reference != null && !reference.isBlank() ? reference : trxref;

        URI location;
        if (effectiveReference == null || effectiveReference.isBlank()) {
            log.warn("Gateway redirect without a reference");
            location = UriComponentsBuilder.fromHttpUrl(frontendUrl)
                    .path("/checkout/payment-failed")
                    .queryParam("error", "no_reference")
                    .build()
                    .toUri();
        } else {
            log.info("Gateway redirect for reference {}", effectiveReference);
            location = UriComponentsBuilder.fromHttpUrl(frontendUrl)
                    .path("/checkout/payment-confirmation")
                    .queryParam("reference", effectiveReference)
                    .encode()
                    .build()
                    .toUri();
        }

        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }
}
