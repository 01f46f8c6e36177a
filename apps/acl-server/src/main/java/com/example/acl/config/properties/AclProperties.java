package com.example.acl.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for predicate-level access control.
 *
 * @param refreshInterval how often every instance reloads its permission snapshot
 * @param reservedPrefix  case-insensitive namespace prefix of system predicates
 * @param guardiansGroup  name of the superuser group
 * @param grootUser       bootstrap superuser created at first startup
 * @param grootPassword   initial password of the bootstrap superuser
 * @param store           rule store backend, "memory" or "mongo"
 */
@ConfigurationProperties(prefix = "app.acl")
public record AclProperties(
        Duration refreshInterval,
        String reservedPrefix,
        String guardiansGroup,
        String grootUser,
        String grootPassword,
        String store
) {
    public AclProperties {
        if (refreshInterval == null || refreshInterval.isZero() || refreshInterval.isNegative()) {
            refreshInterval = Duration.ofSeconds(30);
        }
        if (reservedPrefix == null || reservedPrefix.isBlank()) {
            reservedPrefix = "dgraph.";
        }
        if (guardiansGroup == null || guardiansGroup.isBlank()) {
            guardiansGroup = "guardians";
        }
        if (grootUser == null || grootUser.isBlank()) {
            grootUser = "groot";
        }
        if (grootPassword == null || grootPassword.isBlank()) {
            grootPassword = "password";
        }
        if (store == null || store.isBlank()) {
            store = "memory";
        }
    }

    public static AclProperties defaults() {
        return new AclProperties(null, null, null, null, null, null);
    }

    public AclProperties withRefreshInterval(Duration interval) {
        return new AclProperties(interval, reservedPrefix, guardiansGroup, grootUser, grootPassword, store);
    }
}
