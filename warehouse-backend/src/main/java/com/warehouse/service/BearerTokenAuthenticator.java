package com.warehouse.service;

import com.warehouse.config.WarehouseConfig;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks {@code Authorization: Bearer <token>} headers against the configured API token.
 *
 * <p>An empty configured token authenticates nobody.
 */
@Component
public class BearerTokenAuthenticator {

    static final String BEARER_SCHEME = "Bearer";

    private final byte[] expectedToken;

    public BearerTokenAuthenticator(WarehouseConfig config) {
        String token = config.apiToken() != null ? config.apiToken() : "";
        this.expectedToken = token.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @param authorizationHeader raw header value, may be null
     * @throws UnauthorizedException if the header is absent, not a bearer credential, carries an empty
     *                               or wrong token, or no token is configured
     */
    public void authenticate(String authorizationHeader) {
        String credential = extractCredential(authorizationHeader);
        if (credential == null || credential.isEmpty()) {
            throw new UnauthorizedException("Not authenticated");
        }
        // MessageDigest.isEqual runs in time independent of where the first mismatch is.
        if (expectedToken.length == 0
                || !MessageDigest.isEqual(credential.getBytes(StandardCharsets.UTF_8), expectedToken)) {
            throw new UnauthorizedException("Invalid authentication token");
        }
    }

    static String extractCredential(String authorizationHeader) {
        if (authorizationHeader == null) {
            return null;
        }
        String value = authorizationHeader.trim();
        if (value.length() < BEARER_SCHEME.length()
                || !value.regionMatches(true, 0, BEARER_SCHEME, 0, BEARER_SCHEME.length())) {
            return null;
        }
        String rest = value.substring(BEARER_SCHEME.length());
        if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0))) {
            return null;
        }
        return rest.trim();
    }
}
