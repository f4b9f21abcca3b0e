package com.flagship.storefront_payments.security;

import com.flagship.storefront_payments.observability.CorrelationContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Resolves the bearer token of each request into a {@link CallerIdentity} request attribute.
 *
 * The filter never rejects a request itself: endpoints that need a caller declare a
 * {@link CallerIdentity} parameter and {@link CallerIdentityArgumentResolver} answers 401
 * when the attribute is absent. The webhook and the gateway redirect stay reachable without a token.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class AuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String token = resolveToken(request);
        if (token != null) {
            jwtTokenProvider.resolve(token).ifPresent(caller -> {
                request.setAttribute(CallerIdentity.REQUEST_ATTRIBUTE, caller);
                MDC.put(CorrelationContext.USER_ID_MDC_KEY, caller.getUserId().toString());
            });
        }

        filterChain.doFilter(request, response);
    }

    private String resolveToken(HttpServletRequest request) {
        String bearer = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (bearer != null && bearer.startsWith(BEARER_PREFIX)) {
            String token = bearer.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
