package com.qqsuccubus.social.socket.connection;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named broadcast groups of connections. Each user id names the group its devices join
 * with {@code joinUserRoom}; direct messages reach that group in addition to the user's
 * presence connections.
 */
public class GroupRegistry {

    private final Map<String, Set<String>> membersByGroup = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> groupsByConnection = new ConcurrentHashMap<>();

    public void join(String group, String connectionId) {
        groupsByConnection.computeIfAbsent(connectionId, id -> ConcurrentHashMap.newKeySet()).add(group);
        membersByGroup.compute(group, (name, members) -> {
            Set<String> set = members == null ? ConcurrentHashMap.<String>newKeySet() : members;
            set.add(connectionId);
            return set;
        });
    }

    public void leave(String group, String connectionId) {
        groupsByConnection.computeIfPresent(connectionId, (id, groups) -> {
            groups.remove(group);
            return groups.isEmpty() ? null : groups;
        });
        membersByGroup.computeIfPresent(group, (name, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }

    /**
     * Removes the connection from every group it joined.
     */
    public void leaveAll(String connectionId) {
        Set<String> groups = groupsByConnection.remove(connectionId);
        if (groups == null) {
            return;
        }
        for (String group : groups) {
            membersByGroup.computeIfPresent(group, (name, members) -> {
                members.remove(connectionId);
                return members.isEmpty() ? null : members;
            });
        }
    }

    public Set<String> members(String group) {
        Set<String> members = membersByGroup.get(group);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public void clear() {
        membersByGroup.clear();
        groupsByConnection.clear();
    }
}
