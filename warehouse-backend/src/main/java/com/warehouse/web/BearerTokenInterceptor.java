package com.warehouse.web;

import com.warehouse.service.BearerTokenAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Requires a valid bearer token before any {@code /api/**} handler runs.
 *
 * <p>Runs inside Spring MVC, so it sees the same decoded path the handler mapping matched and
 * comes after the CORS interceptor. Failures propagate as
 * {@link com.warehouse.service.UnauthorizedException} to {@link GlobalExceptionHandler}.
 */
public class BearerTokenInterceptor implements HandlerInterceptor {

    private final BearerTokenAuthenticator authenticator;

    public BearerTokenInterceptor(BearerTokenAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }
        authenticator.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
        return true;
    }
}
