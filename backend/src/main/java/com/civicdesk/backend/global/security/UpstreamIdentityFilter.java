package com.civicdesk.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

import com.civicdesk.backend.global.config.RbacProperties;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Trusts the user id forwarded by the gateway and binds it as the authenticated principal.
 * Session and token validation happen upstream.
 */
@Component
public class UpstreamIdentityFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(UpstreamIdentityFilter.class);

    private final RbacProperties properties;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public UpstreamIdentityFilter(RbacProperties properties, RestAuthenticationEntryPoint authenticationEntryPoint) {
        this.properties = properties;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(properties.getIdentityHeader());
        if (StringUtils.hasText(header)) {
            UUID userId;
            try {
                userId = UUID.fromString(header.trim());
            } catch (IllegalArgumentException ex) {
                log.debug("Rejected malformed identity header value");
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.commence(request, response,
                        new BadCredentialsException("INVALID_IDENTITY_HEADER", ex));
                return;
            }
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(new AuthenticatedActor(userId), null, List.of());
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/health") || path.equals("/readyz") || path.startsWith("/actuator/health");
    }
}
