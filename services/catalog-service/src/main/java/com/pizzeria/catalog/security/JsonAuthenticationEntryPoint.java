package com.pizzeria.catalog.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pizzeria.catalog.dto.ErrorResponse;
import com.pizzeria.catalog.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Answers unauthenticated calls to protected routes with 401,
 * {@code WWW-Authenticate: Bearer} and a {@code {"detail": "..."}} body.
 */
@Component
@RequiredArgsConstructor
public class JsonAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String NOT_AUTHENTICATED = "Not authenticated";

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        Object failure = request.getAttribute(JwtAuthenticationFilter.AUTHENTICATION_FAILURE_ATTRIBUTE);
        String detail = failure instanceof UnauthorizedException
                ? ((UnauthorizedException) failure).getMessage()
                : NOT_AUTHENTICATED;

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(detail));
    }
}
