package com.conflictdata.security;

/**
 * Principal placed in the security context for a request with a valid bearer token.
 */
public record AuthenticatedUser(Long userId, String username, boolean admin) {
}
