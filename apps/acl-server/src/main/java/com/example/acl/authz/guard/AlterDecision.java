package com.example.acl.authz.guard;

/**
 * Outcome of the reserved-namespace check for one predicate alteration.
 *
 * @param allowed whether the alteration may proceed to the permission check
 * @param reason  client-visible denial reason, null when allowed
 */
public record AlterDecision(boolean allowed, String reason) {

    private static final AlterDecision ALLOW = new AlterDecision(true, null);

    public static AlterDecision allow() {
        return ALLOW;
    }

    public static AlterDecision deny(String reason) {
        return new AlterDecision(false, reason);
    }
}
