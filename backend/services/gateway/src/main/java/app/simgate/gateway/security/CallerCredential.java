package app.simgate.gateway.security;

/**
 * Bearer token supplied by the caller, valid for a single inbound request.
 * <p>
 * Passed explicitly to every upstream call; never stored on shared components.
 */
public record CallerCredential(String token) {

    public CallerCredential {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token is required");
        }
    }

    public String bearerHeader() {
        return "Bearer " + token;
    }

    @Override
    public String toString() {
        return "CallerCredential[token=***]";
    }
}
