package com.tollgate.authorizer.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.authorizer.service.AuthorizationService;
import com.tollgate.security.AuthorizationDecision;
import com.tollgate.security.AuthorizationRequest;
import com.tollgate.security.RequestHeaders;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Gates downstream endpoints on the client token.
 *
 * <p>Registered by {@code AuthorizerConfiguration} for the configured protected paths. On Deny the
 * request ends with 401 and {@code {"errorType": "..."}}; on Allow the hashed principal id is
 * exposed as the {@value #PRINCIPAL_ATTRIBUTE} request attribute and the chain continues.
 */
public class AuthorizationGateFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationGateFilter.class);

    public static final String PRINCIPAL_ATTRIBUTE = "tollgate.principalId";

    private final AuthorizationService authorizationService;
    private final ObjectMapper objectMapper;

    public AuthorizationGateFilter(
            AuthorizationService authorizationService, ObjectMapper objectMapper) {
        this.authorizationService = authorizationService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String resource = request.getMethod() + " " + request.getRequestURI();
        AuthorizationDecision decision =
                authorizationService.authorize(
                        new AuthorizationRequest(headersOf(request), resource, null));

        if (!decision.isAllowed()) {
            log.debug("Rejecting {} with 401", resource);
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), decision.context());
            return;
        }

        request.setAttribute(PRINCIPAL_ATTRIBUTE, decision.principalId());
        filterChain.doFilter(request, response);
    }

    static RequestHeaders headersOf(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        Enumeration<String> names = request.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.putIfAbsent(name, request.getHeader(name));
        }
        return RequestHeaders.of(headers);
    }
}
