package cloud.adauth.guard;

/**
 * Outcome of an {@link AccessGuard} check, mapped by the routing layer to a response.
 *
 * @param outcome what the caller should do
 * @param redirect where to send a forbidden user, or {@code null} to answer 403 with {@code message}
 * @param message human readable reason for a denial, {@code null} when allowed
 */
public record AccessDecision(Outcome outcome, String redirect, String message) {

    public enum Outcome {
        ALLOW,
        /** No usable session; the user has to sign in. */
        UNAUTHENTICATED,
        /** Signed in but missing the required group. */
        FORBIDDEN
    }

    static AccessDecision allow() {
        return new AccessDecision(Outcome.ALLOW, null, null);
    }

    static AccessDecision unauthenticated() {
        return new AccessDecision(Outcome.UNAUTHENTICATED, null, "authentication required");
    }

    static AccessDecision forbidden(String redirect, String message) {
        return new AccessDecision(Outcome.FORBIDDEN, redirect, message);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOW;
    }
}
