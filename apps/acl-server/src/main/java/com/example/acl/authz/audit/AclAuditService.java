package com.example.acl.authz.audit;

import com.example.acl.auth.model.Identity;
import com.example.acl.authz.enforcement.RequestKind;
import com.example.acl.common.util.StringSanitizer;
import com.example.acl.observability.AclMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.Locale;

/**
 * Publishes enforcement decisions to the {@code ACL_AUDIT} logger as JSON and counts them.
 */
@Service
public class AclAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("ACL_AUDIT");

    private final ObjectMapper objectMapper;
    private final AclMetrics metrics;
    private final Clock clock;

    public AclAuditService(ObjectMapper objectMapper, AclMetrics metrics, Clock clock) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void allowed(@NonNull RequestKind request, @NonNull Identity identity, @NonNull Collection<String> predicates) {
        record(AclAuditEvent.of(AclAuditEvent.Outcome.ALLOW, request, identity, predicates, null, clock.instant()));
    }

    public void elided(@NonNull RequestKind request, @NonNull Identity identity, @NonNull Collection<String> predicates) {
        record(AclAuditEvent.of(AclAuditEvent.Outcome.ELIDED, request, identity, predicates,
                "unreadable predicates removed", clock.instant()));
    }

    public void denied(
            @NonNull RequestKind request,
            @NonNull Identity identity,
            @NonNull Collection<String> predicates,
            @Nullable String reason) {
        record(AclAuditEvent.of(AclAuditEvent.Outcome.DENY, request, identity, predicates, reason, clock.instant()));
    }

    private void record(@NonNull AclAuditEvent event) {
        metrics.recordDecision(event.request().tag(), event.outcome().name().toLowerCase(Locale.ROOT));
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            if (event.outcome() == AclAuditEvent.Outcome.DENY) {
                AUDIT_LOG.warn(json);
            } else {
                AUDIT_LOG.info(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("ACL {} - request={}, user={}, predicates={}, reason={}",
                    event.outcome(),
                    event.request().tag(),
                    StringSanitizer.forLog(event.userId()),
                    event.predicates().size(),
                    StringSanitizer.forLog(event.reason()));
        }
    }
}
