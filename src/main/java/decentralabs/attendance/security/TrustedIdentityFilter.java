package decentralabs.attendance.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Populates the security context from the identity headers set by the upstream auth gateway.
 * No credential is checked here; when a gateway token is configured, requests that do not
 * carry it are refused so the headers cannot be forged by clients talking to this service directly.
 */
public class TrustedIdentityFilter extends OncePerRequestFilter {

    public static final String ROLE_INSTRUCTOR = "ROLE_INSTRUCTOR";
    public static final String ROLE_ATTENDEE = "ROLE_ATTENDEE";

    private final String userHeader;
    private final String rolesHeader;
    private final String gatewayTokenHeader;
    private final String gatewayToken;

    public TrustedIdentityFilter(String userHeader, String rolesHeader, String gatewayTokenHeader, String gatewayToken) {
        this.userHeader = userHeader;
        this.rolesHeader = rolesHeader;
        this.gatewayTokenHeader = gatewayTokenHeader;
        this.gatewayToken = gatewayToken;
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String user = request.getHeader(userHeader);
        if (user == null || user.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        if (gatewayToken != null && !gatewayToken.isBlank()) {
            String provided = request.getHeader(gatewayTokenHeader);
            if (provided == null || !MessageDigest.isEqual(
                gatewayToken.getBytes(StandardCharsets.UTF_8),
                provided.trim().getBytes(StandardCharsets.UTF_8))) {
                response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized");
                return;
            }
        }

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                user.trim(),
                null,
                parseRoles(request.getHeader(rolesHeader))
            );
            SecurityContextHolder.getContext().setAuthentication(auth);
        }

        filterChain.doFilter(request, response);
    }

    static List<GrantedAuthority> parseRoles(String header) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority(ROLE_ATTENDEE));
        if (header == null || header.isBlank()) {
            return authorities;
        }
        for (String role : header.split(",")) {
            String normalized = role.trim().toUpperCase(Locale.ROOT);
            if (normalized.equals("INSTRUCTOR") || normalized.equals("LECTURER")) {
                authorities.add(new SimpleGrantedAuthority(ROLE_INSTRUCTOR));
            }
        }
        return authorities;
    }
}
