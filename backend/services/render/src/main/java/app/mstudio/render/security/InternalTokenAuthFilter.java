package app.mstudio.render.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Authenticates substrate callbacks on {@code /internal/**} that carry the shared internal token. The request
 * gets a synthetic JWT with the {@code render.internal} scope; any other bearer token is left to the resource
 * server.
 */
public class InternalTokenAuthFilter extends OncePerRequestFilter {

    public static final String INTERNAL_SCOPE = "render.internal";
    public static final String INTERNAL_PATH_PREFIX = "/internal/";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Duration CALLBACK_LIFETIME = Duration.ofMinutes(15);

    private final InternalAuthProps props;

    public InternalTokenAuthFilter(InternalAuthProps props) {
        this.props = props;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !props.enabled() || !request.getRequestURI().startsWith(INTERNAL_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String presented = bearerToken(request);
        if (SecurityContextHolder.getContext().getAuthentication() == null && props.accepts(presented)) {
            SecurityContextHolder.getContext().setAuthentication(substrateAuthentication(presented));
        }
        filterChain.doFilter(request, response);
    }

    public static String bearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static JwtAuthenticationToken substrateAuthentication(String token) {
        Instant now = Instant.now();
        Jwt jwt = Jwt.withTokenValue(token)
                .header("alg", "none")
                .subject("execution-substrate")
                .claim("scope", INTERNAL_SCOPE)
                .issuedAt(now)
                .expiresAt(now.plus(CALLBACK_LIFETIME))
                .build();
        return new JwtAuthenticationToken(jwt, List.of(new SimpleGrantedAuthority("SCOPE_" + INTERNAL_SCOPE)));
    }
}
