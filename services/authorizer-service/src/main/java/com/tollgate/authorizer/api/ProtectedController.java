package com.tollgate.authorizer.api;

import com.tollgate.authorizer.infrastructure.web.AuthorizationGateFilter;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Minimal endpoint behind the authorization gate; lets callers check that their token is accepted
 * and see the principal id it maps to.
 */
@RestController
@RequestMapping("/api/v1/protected")
public class ProtectedController {

    @GetMapping("/whoami")
    public Map<String, String> whoami(
            @RequestAttribute(AuthorizationGateFilter.PRINCIPAL_ATTRIBUTE) String principalId) {
        return Map.of("principalId", principalId);
    }
}
