package com.example.acl.authz.audit;

import com.example.acl.auth.model.Identity;
import com.example.acl.authz.enforcement.RequestKind;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for one enforcement decision.
 */
public record AclAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,

        // Decision
        Outcome outcome,
        RequestKind request,
        String reason,

        // Subject
        String userId,
        boolean anonymous,
        boolean guardian,

        // Predicates the decision concerned
        List<String> predicates
) {
    public enum Outcome {
        /**
         * Forwarded unchanged.
         */
        ALLOW,
        /**
         * Forwarded with unreadable clauses removed.
         */
        ELIDED,
        DENY
    }

    public AclAuditEvent {
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
    }

    public static AclAuditEvent of(
            Outcome outcome,
            RequestKind request,
            Identity identity,
            Collection<String> predicates,
            String reason,
            Instant timestamp) {

        return new AclAuditEvent(
                UUID.randomUUID().toString(),
                timestamp,
                outcome,
                request,
                reason,
                identity.userId(),
                identity.anonymous(),
                identity.guardian(),
                predicates == null ? List.of() : List.copyOf(predicates)
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "acl_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("request", request.tag()),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("user_id", userId != null ? userId : ""),
                Map.entry("anonymous", anonymous),
                Map.entry("guardian", guardian),
                Map.entry("predicates", predicates)
        );
    }
}
