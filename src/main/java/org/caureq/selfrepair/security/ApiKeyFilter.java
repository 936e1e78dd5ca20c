package org.caureq.selfrepair.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.security.MessageDigest;
import java.nio.charset.StandardCharsets;

/** Guards the admin routes with the X-API-KEY header. No configured key means admin routes are closed. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {
    private final SupervisorProps props;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        return !req.getRequestURI().startsWith("/api/admin/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        String expected = props.apiKey();
        String key = req.getHeader("X-API-KEY");
        if (expected == null || expected.isBlank() || key == null || !matches(key, expected)) {
            log.warn("[Api] rejected {} {} from {}", req.getMethod(), req.getRequestURI(), req.getRemoteAddr());
            res.setStatus(HttpStatus.UNAUTHORIZED.value());
            res.setContentType("application/json");
            res.getWriter().write("{\"code\":\"AUTH_REQUIRED\",\"message\":\"Missing or invalid X-API-KEY\"}");
            return;
        }
        chain.doFilter(req, res);
    }

    private static boolean matches(String given, String expected) {
        return MessageDigest.isEqual(given.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
