package app.simgate.gateway.security;

import app.simgate.gateway.error.GatewayErrorKind;
import app.simgate.gateway.error.GatewayException;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthentication;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class CurrentCallerProvider {

    public Optional<CallerCredential> getCredential(Authentication authentication) {
        if (authentication instanceof BearerTokenAuthentication bearer) {
            return Optional.of(new CallerCredential(bearer.getToken().getTokenValue()));
        }
        return Optional.empty();
    }

    public CallerCredential requireCredential(Authentication authentication) {
        return getCredential(authentication)
                .orElseThrow(() -> GatewayException.of(GatewayErrorKind.UNAUTHORIZED,
                        "Authorization header with a Bearer token is required"));
    }
}
