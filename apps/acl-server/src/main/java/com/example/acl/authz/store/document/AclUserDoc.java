package com.example.acl.authz.store.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB document for an ACL user. Links to its groups by name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "acl_users")
public class AclUserDoc {

    /**
     * User name, unique across the cluster.
     */
    @Id
    private String name;

    /**
     * Optimistic lock; concurrent read-modify-write cycles on one document fail instead of overwriting each other.
     */
    @Version
    private Long version;

    /**
     * BCrypt hash, never the raw password.
     */
    private String passwordHash;

    @Indexed
    @Builder.Default
    private List<String> groups = new ArrayList<>();

    private Instant createdAt;
}
