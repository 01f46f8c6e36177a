package com.example.acl.authz.admin;

import com.example.acl.authz.model.AclRule;

import java.util.List;

/**
 * A user with the grants and fellow members of each group it belongs to.
 *
 * @param groups ordered by group name
 */
public record UserDetails(String name, List<GroupDetails> groups) {

    public UserDetails {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    /**
     * @param members user names, sorted
     */
    public record GroupDetails(String name, List<AclRule> rules, List<String> members) {

        public GroupDetails {
            rules = rules == null ? List.of() : List.copyOf(rules);
            members = members == null ? List.of() : List.copyOf(members);
        }
    }
}
