package com.rollcall.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.rollcall.backend.global.error.AuthorizationException;
import com.rollcall.backend.global.error.StoreException;
import com.rollcall.backend.modules.auth.application.AuthorizedSession;
import com.rollcall.backend.modules.auth.application.JwtTokenService;
import com.rollcall.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.rollcall.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.rollcall.backend.modules.auth.application.RoleGate;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Restores the session of each bearer-authenticated request. The token's role claim is re-checked against the
 * directory through {@link RoleGate#restore}, so a token minted before a role change or deactivation is refused.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final RoleGate roleGate;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            RoleGate roleGate,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.jwtTokenService = jwtTokenService;
        this.roleGate = roleGate;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            try {
                ParsedToken parsed = jwtTokenService.parseAccessToken(token);
                AuthorizedSession session = roleGate.restore(parsed.userId(), parsed.role());

                SessionPrincipal principal = new SessionPrincipal(session.userId(), session.email(), session.role());
                List<SimpleGrantedAuthority> authorities =
                        List.of(new SimpleGrantedAuthority("ROLE_" + session.role().code()));

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (InvalidTokenException ex) {
                SecurityContextHolder.clearContext();
                problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED,
                        "auth.invalid_access_token", "Access token is invalid or expired");
                return;
            } catch (AuthorizationException ex) {
                SecurityContextHolder.clearContext();
                log.info("Session restore refused: {}", ex.getCode());
                problemResponseWriter.write(request, response, HttpStatus.FORBIDDEN, ex.getCode(), ex.getDetailMessage());
                return;
            } catch (StoreException ex) {
                SecurityContextHolder.clearContext();
                log.error("Directory unavailable while restoring session", ex);
                response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
                problemResponseWriter.write(request, response, HttpStatus.SERVICE_UNAVAILABLE, ex.getCode(), ex.getDetailMessage());
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/auth/")
                || path.startsWith("/health")
                || path.startsWith("/readyz")
                || path.startsWith("/actuator");
    }
}
