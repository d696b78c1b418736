package org.schemadiff.diff;

import org.schemadiff.model.SchemaNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Pairs old members with new members.
 * <p>
 * Identity keys win: two members with the same identity are the same member even if
 * renamed. Name matching is only a fallback when at least one side carries no identity,
 * so two members that both declare identities but disagree are never paired by name.
 */
final class MemberMatcher {

    private MemberMatcher() {
    }

    /**
     * @return old member name to new member name, in old declaration order
     */
    static Map<String, String> match(Map<String, SchemaNode> oldMembers, Map<String, SchemaNode> newMembers) {
        Map<String, String> newByIdentity = new HashMap<>();
        newMembers.forEach((name, node) -> {
            String identity = node.getMetadata().getIdentity();
            if (identity != null) {
                newByIdentity.putIfAbsent(identity, name);
            }
        });

        Map<String, String> matches = new HashMap<>();
        Set<String> usedNew = new HashSet<>();

        // 1차: identity 기준
        oldMembers.forEach((name, node) -> {
            String identity = node.getMetadata().getIdentity();
            if (identity == null) return;
            String candidate = newByIdentity.get(identity);
            if (candidate != null && usedNew.add(candidate)) {
                matches.put(name, candidate);
            }
        });

        // 2차: 이름 기준 (양쪽 모두 identity가 있으면 제외)
        oldMembers.forEach((name, node) -> {
            if (matches.containsKey(name)) return;
            SchemaNode candidate = newMembers.get(name);
            if (candidate == null || usedNew.contains(name)) return;
            if (node.getMetadata().hasIdentity() && candidate.getMetadata().hasIdentity()) return;
            usedNew.add(name);
            matches.put(name, name);
        });

        Map<String, String> ordered = new LinkedHashMap<>();
        oldMembers.keySet().forEach(name -> {
            if (matches.containsKey(name)) {
                ordered.put(name, matches.get(name));
            }
        });
        return ordered;
    }
}
