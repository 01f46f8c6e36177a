package com.example.acl.authz.store.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB document for an ACL group. Rules are embedded so a group and its grants
 * are always read and written together.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "acl_groups")
public class AclGroupDoc {

    @Id
    private String name;

    /**
     * Optimistic lock; concurrent read-modify-write cycles on one document fail instead of overwriting each other.
     */
    @Version
    private Long version;

    @Builder.Default
    private List<RuleDoc> rules = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleDoc {
        private String predicate;
        private int permission;
    }
}
