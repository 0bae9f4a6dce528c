package com.pizzeria.catalog.security;

import com.pizzeria.catalog.entity.User;
import com.pizzeria.catalog.exception.UnauthorizedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Installs the caller resolved from {@code Authorization: Bearer <token>} as
 * the Spring Security principal.
 *
 * A request without a bearer token passes through anonymously. When a token is
 * present but cannot be resolved, the failure is stored on the request under
 * {@link #AUTHENTICATION_FAILURE_ATTRIBUTE} and the request continues
 * anonymously; protected routes then answer 401 through
 * {@link JsonAuthenticationEntryPoint} with that failure's detail.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTHENTICATION_FAILURE_ATTRIBUTE =
            JwtAuthenticationFilter.class.getName() + ".FAILURE";

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityService identityService;

    public JwtAuthenticationFilter(IdentityService identityService) {
        this.identityService = identityService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            try {
                User user = identityService.resolveCurrentUser(token);
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        user, null, List.of(new SimpleGrantedAuthority("ROLE_" + user.getPermissionLevel().name())));
                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(authentication);
                SecurityContextHolder.setContext(context);
            } catch (UnauthorizedException e) {
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTHENTICATION_FAILURE_ATTRIBUTE, e);
            }
        }
        chain.doFilter(request, response);
    }
}
