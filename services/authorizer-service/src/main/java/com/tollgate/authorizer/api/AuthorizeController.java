package com.tollgate.authorizer.api;

import com.tollgate.authorizer.service.AuthorizationService;
import com.tollgate.security.AuthorizationRequest;
import com.tollgate.security.AuthorizerResponse;
import jakarta.validation.Valid;
import java.time.Clock;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Request-authorizer endpoint for API gateways.
 *
 * <p>Always answers 200: Deny is a normal outcome carried in the policy and in {@code
 * context.errorType}, not an HTTP error.
 */
@RestController
@RequestMapping("/api/v1")
public class AuthorizeController {

    private final AuthorizationService authorizationService;
    private final Clock clock;

    public AuthorizeController(AuthorizationService authorizationService, Clock clock) {
        this.authorizationService = authorizationService;
        this.clock = clock;
    }

    @PostMapping("/authorize")
    public AuthorizerResponse authorize(@Valid @RequestBody AuthorizeRequest body) {
        AuthorizationRequest request = AuthorizationRequest.of(body.headers(), body.methodArn());
        if (body.timeoutMillis() != null) {
            request = request.withDeadline(clock.instant().plusMillis(body.timeoutMillis()));
        }
        return authorizationService.respond(request);
    }
}
