package com.ledgerlens.categorizer.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.categorizer.controller.dto.ErrorResponseDto;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Writes 401 and 403 responses as {@link ErrorResponseDto} bodies, like every other API error.
 */
@Component
public class JsonAuthErrorHandlers implements AuthenticationEntryPoint, AccessDeniedHandler {

    private static final Logger log = LoggerFactory.getLogger(JsonAuthErrorHandlers.class);

    private final ObjectMapper objectMapper;

    public JsonAuthErrorHandlers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        writeError(request, response, HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", authException);
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        writeError(request, response, HttpStatus.FORBIDDEN, "FORBIDDEN", accessDeniedException);
    }

    private void writeError(
            HttpServletRequest request,
            HttpServletResponse response,
            HttpStatus status,
            String code,
            Exception ex
    ) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        String traceId = RequestContextHolder.currentTraceId().orElse(null);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("path", request.getRequestURI());
        details.put("timestamp", Instant.now().toString());
        if (ex instanceof OAuth2AuthenticationException oauthEx && oauthEx.getError() != null) {
            details.put("oauth2ErrorCode", oauthEx.getError().getErrorCode());
            details.put("oauth2ErrorDescription", oauthEx.getError().getDescription());
        }

        log.warn("Auth failure status={} path={} traceId={} msg={}", status.value(), request.getRequestURI(), traceId, ex.getMessage());
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getOutputStream(), new ErrorResponseDto(code, ex.getMessage(), details, traceId));
    }
}
