package com.example.acl.authz.admin;

import java.util.Set;

/**
 * A user as shown to administrators, without the password hash.
 */
public record UserSummary(String name, Set<String> groups) {
}
