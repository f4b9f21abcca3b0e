package com.flagship.storefront_payments.security;

import com.flagship.storefront_payments.exception.AuthenticationException;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Injects the authenticated {@link CallerIdentity} into controller methods, or fails
 * the request with 401 when there is none.
 */
@Component
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(MethodParameter parameter,
                                          ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest,
                                          WebDataBinderFactory binderFactory) {
        Object caller = webRequest.getAttribute(CallerIdentity.REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (caller instanceof CallerIdentity identity) {
            return identity;
        }
        throw new AuthenticationException("Missing or invalid bearer token");
    }
}
