package com.bbthechange.tvguide.security;

import com.bbthechange.tvguide.config.TvGuideProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Filter for authenticating operator requests to the internal API.
 * Validates the X-Api-Key header against tvguide.internal.api-key.
 * Only applies to /internal/** endpoints.
 */
@Component
public class InternalApiKeyFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(InternalApiKeyFilter.class);
    static final String API_KEY_HEADER = "X-Api-Key";
    private static final String INTERNAL_PATH_PREFIX = "/internal/";

    private final TvGuideProperties properties;

    public InternalApiKeyFilter(TvGuideProperties properties) {
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Only filter requests to /internal/** endpoints
        return !request.getRequestURI().startsWith(INTERNAL_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String providedApiKey = request.getHeader(API_KEY_HEADER);

        if (providedApiKey == null || providedApiKey.isBlank()) {
            logger.warn("Missing API key for internal endpoint: {}", request.getRequestURI());
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "Missing API key");
            return;
        }

        String expectedApiKey = properties.getInternal().getApiKey();
        if (expectedApiKey == null || expectedApiKey.isBlank()) {
            logger.error("tvguide.internal.api-key is not configured, rejecting internal request");
            writeError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Internal configuration error");
            return;
        }

        if (!MessageDigest.isEqual(
                expectedApiKey.getBytes(StandardCharsets.UTF_8),
                providedApiKey.getBytes(StandardCharsets.UTF_8))) {
            logger.warn("Invalid API key for internal endpoint: {}", request.getRequestURI());
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private static void writeError(HttpServletResponse response, int status, String error) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\": \"" + error + "\"}");
    }
}
