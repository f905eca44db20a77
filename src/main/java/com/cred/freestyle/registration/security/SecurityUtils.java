package com.cred.freestyle.registration.security;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Helpers for reading the caller's identity from the security context.
 *
 * @author Registration Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }

        Object principal = authentication.getPrincipal();
        if (principal instanceof String) {
            return (String) principal;
        }
        return authentication.getName();
    }

    /**
     * Get the current user ID, failing if the request is unauthenticated.
     *
     * @return User ID
     * @throws AuthenticationCredentialsNotFoundException if no user is authenticated
     */
    public static String requireCurrentUserId() {
        String userId = getCurrentUserId();
        if (userId == null) {
            throw new AuthenticationCredentialsNotFoundException("User not authenticated");
        }
        return userId;
    }
}
