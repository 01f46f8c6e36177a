package com.example.acl.authz.model;

/**
 * A user's membership in a group.
 */
public record Membership(String user, String group) {
}
