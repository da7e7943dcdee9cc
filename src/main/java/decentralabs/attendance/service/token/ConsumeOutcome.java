package decentralabs.attendance.service.token;

/**
 * Result of {@link TokenStore#tryConsume}. The store never reports anything else.
 */
public enum ConsumeOutcome {
    ACCEPTED,
    ALREADY_CONSUMED_BY_THIS_ATTENDEE,
    TOKEN_INVALID
}
