package com.flagship.personal_ledger.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.personal_ledger.common.exception.GlobalExceptionHandler.ErrorResponse;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.observability.CorrelationContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Binds the verified owner of every /api request. Requests without a valid
 * bearer token are answered with 401 and never reach a controller.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
@Slf4j
public class AuthenticatedOwnerFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final OwnerTokenVerifier tokenVerifier;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        Optional<UUID> ownerId = header != null && header.startsWith(BEARER_PREFIX)
                ? tokenVerifier.verify(header.substring(BEARER_PREFIX.length()).trim())
                : Optional.empty();

        if (ownerId.isEmpty()) {
            log.warn("Unauthenticated request rejected: method={}, uri={}", request.getMethod(), request.getRequestURI());
            writeUnauthorized(response);
            return;
        }

        try {
            OwnerContext.set(ownerId.get());
            MDC.put(CorrelationContext.OWNER_ID_MDC_KEY, ownerId.get().toString());
            filterChain.doFilter(request, response);
        } finally {
            OwnerContext.clear();
            MDC.remove(CorrelationContext.OWNER_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        ErrorResponse error = ErrorResponse.builder()
                .error("Unauthorized")
                .code(LedgerErrorCode.UNAUTHENTICATED.code())
                .message("A valid bearer token is required")
                .timestamp(Instant.now())
                .build();
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
