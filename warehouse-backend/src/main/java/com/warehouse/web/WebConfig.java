package com.warehouse.web;

import com.warehouse.service.BearerTokenAuthenticator;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Open CORS policy for browser dashboards reading the API, and bearer auth on {@code /api/**}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final String PROTECTED_PATTERN = "/api/**";

    private final BearerTokenAuthenticator authenticator;

    public WebConfig(BearerTokenAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // allowCredentials rules out the literal "*" origin, patterns are required.
        registry.addMapping("/**")
                .allowedOriginPatterns("*")
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new BearerTokenInterceptor(authenticator))
                .addPathPatterns(PROTECTED_PATTERN);
    }
}
