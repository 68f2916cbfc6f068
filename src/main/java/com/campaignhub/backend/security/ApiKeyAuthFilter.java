package com.campaignhub.backend.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.List;

/**
 * Bearer API key authentication for the campaign endpoints.
 *
 * Requests without a known key pass through unauthenticated and are rejected by the
 * security chain.
 */
@Component
@Slf4j
public class ApiKeyAuthFilter extends OncePerRequestFilter {

    public static final String API_CLIENT_PRINCIPAL = "api-client";
    public static final String API_CLIENT_ROLE = "ROLE_API_CLIENT";

    private static final String BEARER_PREFIX = "Bearer ";

    private final List<byte[]> apiKeys;

    public ApiKeyAuthFilter(@Value("${security.api.keys:}") String configuredKeys) {
        this.apiKeys = Arrays.stream(configuredKeys.split(","))
                .map(String::trim)
                .filter(key -> !key.isEmpty())
                .map(key -> key.getBytes(StandardCharsets.UTF_8))
                .toList();

        if (apiKeys.isEmpty()) {
            log.warn("No API keys configured (security.api.keys); every campaign request will be rejected");
        }
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            log.debug("No Bearer token found for: {} {}", request.getMethod(), request.getRequestURI());
            filterChain.doFilter(request, response);
            return;
        }

        String presented = authHeader.substring(BEARER_PREFIX.length()).trim();

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            if (isKnownKey(presented)) {
                UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                        API_CLIENT_PRINCIPAL, null, List.of(new SimpleGrantedAuthority(API_CLIENT_ROLE)));
                authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authToken);
            } else {
                log.warn("Invalid API key on: {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    private boolean isKnownKey(String presented) {
        byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (byte[] key : apiKeys) {
            // constant time per key
            match |= MessageDigest.isEqual(key, candidate);
        }
        return match;
    }
}
