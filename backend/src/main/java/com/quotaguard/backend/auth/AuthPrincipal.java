package com.quotaguard.backend.auth;

import org.springframework.security.core.GrantedAuthority;

import java.util.Collection;

/**
 * Caller identity as loaded for this request. {@code role} is the stored role code at load time.
 */
public record AuthPrincipal(Long id, String email, String role, Collection<? extends GrantedAuthority> authorities) {}
