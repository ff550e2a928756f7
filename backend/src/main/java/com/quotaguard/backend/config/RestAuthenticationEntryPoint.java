package com.quotaguard.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotaguard.backend.dto.ApiError;
import com.quotaguard.backend.filter.TrustedPrincipalHeaderFilter;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 401 for requests that arrive without a resolvable {@value TrustedPrincipalHeaderFilter#HEADER}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException, ServletException {
        log.warn("Unauthenticated request to {} (header {}: {})", request.getRequestURI(),
                TrustedPrincipalHeaderFilter.HEADER, request.getHeader(TrustedPrincipalHeaderFilter.HEADER));
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(),
                ApiError.of("AUTH_REQUIRED", "A known, non-expired principal is required"));
    }
}
