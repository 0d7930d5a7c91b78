package tether.core.model.session;

/**
 * Access and refresh credentials issued together.
 *
 * @param accessToken  access credential
 * @param refreshToken refresh credential (may be null)
 * @param expiresIn    access token lifetime in seconds
 */
public record TokenPair(String accessToken, String refreshToken, long expiresIn) {

    public TokenPair {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or blank");
        }
    }
}
