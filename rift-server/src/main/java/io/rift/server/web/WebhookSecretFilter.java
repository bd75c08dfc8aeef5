package io.rift.server.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rift.server.api.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * Rejects webhook calls whose {@code X-RIFT-SECRET} header does not match the
 * configured secret. Runs before any store access.
 */
public class WebhookSecretFilter extends OncePerRequestFilter {
    public static final String HEADER = "X-RIFT-SECRET";

    private static final Logger log = LoggerFactory.getLogger(WebhookSecretFilter.class);

    private final byte[] expected;
    private final ObjectMapper mapper;

    public WebhookSecretFilter(String secret, ObjectMapper mapper) {
        this.expected = Objects.requireNonNull(secret, "secret").getBytes(StandardCharsets.UTF_8);
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String provided = request.getHeader(HEADER);
        if (provided == null) {
            reject(request, response, "Missing " + HEADER + " header");
            return;
        }
        // constant time
        if (!MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.UTF_8))) {
            reject(request, response, "Invalid webhook secret");
            return;
        }
        chain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String detail)
            throws IOException {
        log.warn("Rejected webhook from {}: {}", request.getRemoteAddr(), detail);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        mapper.writeValue(response.getOutputStream(), ErrorResponse.of(ErrorResponse.UNAUTHORIZED, detail));
    }
}
