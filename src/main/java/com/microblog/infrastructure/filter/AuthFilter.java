package com.microblog.infrastructure.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microblog.adapter.in.web.ErrorResponse;
import com.microblog.adapter.in.web.ErrorResponses;
import com.microblog.application.port.in.VerifyCredentialUseCase;
import com.microblog.domain.error.AuthError;
import com.microblog.domain.error.ErrorKind;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.infrastructure.config.AppProperties;
import com.microblog.infrastructure.context.RequestContext;
import com.microblog.infrastructure.exception.BusinessException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;
import java.util.UUID;

/**
 * Resolves the caller from the API key header and binds it to {@link RequestContext}.
 * Admin endpoints are guarded by a shared operator token instead.
 */
@Component
@Order(1)
public class AuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    private static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";
    private static final String ADMIN_PATH = "/api/v1/admin";

    private static final Set<String> PUBLIC_PATHS = Set.of(
        "/actuator",
        "/v3/api-docs",
        "/swagger-ui",
        "/static/media"
    );

    private final VerifyCredentialUseCase verifyCredentialUseCase;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public AuthFilter(
            VerifyCredentialUseCase verifyCredentialUseCase,
            AppProperties appProperties,
            ObjectMapper objectMapper) {
        this.verifyCredentialUseCase = verifyCredentialUseCase;
        this.appProperties = appProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();
        String requestId = getOrGenerateRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            if (isPublicPath(path)) {
                RequestContext.setRequestId(requestId);
                filterChain.doFilter(request, response);
                return;
            }

            if (path.startsWith(ADMIN_PATH)) {
                RequestContext.setRequestId(requestId);
                if (!isValidAdminToken(request.getHeader(ADMIN_TOKEN_HEADER))) {
                    log.warn("Rejected admin request without a valid {} for path: {}", ADMIN_TOKEN_HEADER, path);
                    writeError(response, ErrorKind.PERMISSION_DENIED, "ADMIN_TOKEN_INVALID",
                        "A valid " + ADMIN_TOKEN_HEADER + " header is required", requestId);
                    return;
                }
                filterChain.doFilter(request, response);
                return;
            }

            String header = appProperties.getSecurity().getApiKeyHeader();
            Result<User, AuthError> result;
            try {
                result = verifyCredentialUseCase.verifyCredential(request.getHeader(header));
            } catch (BusinessException e) {
                log.error("Credential check failed for path {}: {}", path, e.getErrorCode());
                writeError(response, e.getKind(), e.getErrorCode(), e.getMessage(), requestId);
                return;
            }
            if (result.isFailure()) {
                AuthError error = result.errorOrNull();
                log.warn("Authentication failed for path {}: {}", path, error.code());
                writeError(response, error.kind(), error.code(), error.message(), requestId);
                return;
            }

            User user = result.getOrThrow();
            RequestContext.set(user.id(), requestId);
            log.debug("Request authenticated: userId={}, path={}", user.id(), path);

            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private boolean isPublicPath(String path) {
        return PUBLIC_PATHS.stream().anyMatch(path::startsWith);
    }

    private boolean isValidAdminToken(String supplied) {
        String expected = appProperties.getSecurity().getAdminToken();
        if (expected == null || expected.isBlank() || supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            supplied.getBytes(StandardCharsets.UTF_8));
    }

    private void writeError(
            HttpServletResponse response,
            ErrorKind kind,
            String code,
            String message,
            String requestId) throws IOException {
        response.setStatus(ErrorResponses.statusOf(kind).value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), new ErrorResponse(code, message, requestId));
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
