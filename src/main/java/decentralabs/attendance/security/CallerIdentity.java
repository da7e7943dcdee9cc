package decentralabs.attendance.security;

import java.security.Principal;

/**
 * Resolves the already-authenticated caller of a request.
 */
public final class CallerIdentity {

    private CallerIdentity() {
    }

    public static String require(Principal principal) {
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            throw new SecurityException("Authenticated caller required");
        }
        return principal.getName();
    }
}
