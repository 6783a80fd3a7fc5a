package com.streamfirst.feedrelay.domain;

import lombok.Builder;
import lombok.Value;

import java.util.HashSet;
import java.util.Set;

/**
 * Allow and deny lists applied to a mapping's messages before forwarding.
 * Empty allow lists admit everything; deny lists always apply.
 */
@Value
@Builder(toBuilder = true)
public class FilterProfile {

    public static final FilterProfile EMPTY = FilterProfile.builder().build();

    /** Content tokens of which at least one must appear */
    @Builder.Default Set<String> whitelist = Set.of();
    /** Content tokens that must not appear */
    @Builder.Default Set<String> blacklist = Set.of();
    /** Author ids or usernames allowed to be forwarded */
    @Builder.Default Set<String> allowedSenders = Set.of();
    @Builder.Default Set<String> blockedSenders = Set.of();
    /** Inferred content types, e.g. text, image, embed */
    @Builder.Default Set<String> allowedTypes = Set.of();
    @Builder.Default Set<String> blockedTypes = Set.of();
    @Builder.Default Set<String> allowedRoles = Set.of();
    @Builder.Default Set<String> blockedRoles = Set.of();

    /**
     * Combines this profile with another by union of every list. Used to layer a mapping's own
     * filters on top of the global defaults.
     */
    public FilterProfile merge(FilterProfile other) {
        return FilterProfile.builder()
                .whitelist(union(whitelist, other.whitelist))
                .blacklist(union(blacklist, other.blacklist))
                .allowedSenders(union(allowedSenders, other.allowedSenders))
                .blockedSenders(union(blockedSenders, other.blockedSenders))
                .allowedTypes(union(allowedTypes, other.allowedTypes))
                .blockedTypes(union(blockedTypes, other.blockedTypes))
                .allowedRoles(union(allowedRoles, other.allowedRoles))
                .blockedRoles(union(blockedRoles, other.blockedRoles))
                .build();
    }

    private static Set<String> union(Set<String> left, Set<String> right) {
        Set<String> merged = new HashSet<>(left);
        merged.addAll(right);
        return Set.copyOf(merged);
    }
}
