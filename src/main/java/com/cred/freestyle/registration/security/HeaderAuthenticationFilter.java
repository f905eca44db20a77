package com.cred.freestyle.registration.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * Authentication filter that trusts the identity headers set by the API gateway.
 *
 * Headers:
 * - X-User-Id: opaque user identifier (required for authenticated requests)
 * - X-User-Role: role, defaults to USER
 *
 * Token validation happens upstream; this service never re-validates.
 * Identifiers longer than the user_id column are ignored, leaving the request unauthenticated.
 *
 * @author Registration Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    static final int MAX_USER_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);

        if (userId != null && !userId.isBlank() && userId.length() <= MAX_USER_ID_LENGTH) {
            String role = request.getHeader(USER_ROLE_HEADER);
            if (role == null || role.isBlank()) {
                role = "USER";
            }
            if (!role.startsWith("ROLE_")) {
                role = "ROLE_" + role;
            }

            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    userId.trim(), null, Collections.singletonList(new SimpleGrantedAuthority(role)));
            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated user: {} with role: {}", userId, role);
        } else if (userId != null && !userId.isBlank()) {
            logger.warn("Ignoring {} header longer than {} characters", USER_ID_HEADER, MAX_USER_ID_LENGTH);
        }

        filterChain.doFilter(request, response);
    }
}
