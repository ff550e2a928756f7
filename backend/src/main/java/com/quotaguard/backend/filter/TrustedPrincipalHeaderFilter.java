package com.quotaguard.backend.filter;

import com.quotaguard.backend.auth.AuthPrincipal;
import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.entity.Role;
import com.quotaguard.backend.repository.PrincipalRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates requests from the identity gateway in front of this service, which forwards the
 * caller's principal id in {@value #HEADER}. The principal is reloaded on every request so granted
 * authorities always follow the role currently stored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrustedPrincipalHeaderFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Principal-Id";

    private final PrincipalRepository principalRepository;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String header = request.getHeader(HEADER);
        if (header == null || header.isBlank() || SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        Long principalId = parseId(header);
        if (principalId == null) {
            log.warn("Invalid {} header for URI: {}", HEADER, request.getRequestURI());
            filterChain.doFilter(request, response);
            return;
        }

        principalRepository.findByIdAndDeletedAtIsNull(principalId).ifPresentOrElse(principal -> {
            var authorities = authoritiesOf(principal);
            var authPrincipal = new AuthPrincipal(principal.getId(), principal.getEmail(), principal.getRole(), authorities);
            var auth = new UsernamePasswordAuthenticationToken(authPrincipal, null, authorities);
            SecurityContextHolder.getContext().setAuthentication(auth);
        }, () -> log.warn("Unknown or expired principal {} for URI: {}", principalId, request.getRequestURI()));

        filterChain.doFilter(request, response);
    }

    static List<SimpleGrantedAuthority> authoritiesOf(Principal principal) {
        Optional<Role> role = Role.fromCode(principal.getRole());
        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        role.ifPresent(value -> authorities.add(new SimpleGrantedAuthority(value.authority())));
        if (role.isPresent() && role.get() == Role.SUPER_ADMIN) {
            authorities.add(new SimpleGrantedAuthority(Role.ADMIN.authority()));
        }
        return authorities;
    }

    private static Long parseId(String header) {
        try {
            return Long.valueOf(header.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
