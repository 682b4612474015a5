package com.qqsuccubus.social.socket.connection;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GroupRegistryTest {

    @Test
    void testJoinAndLeaveAll() {
        GroupRegistry groups = new GroupRegistry();
        groups.join("alice", "c1");
        groups.join("alice", "c2");
        groups.join("bob", "c1");

        assertEquals(Set.of("c1", "c2"), groups.members("alice"));

        groups.leaveAll("c1");

        assertEquals(Set.of("c2"), groups.members("alice"));
        assertTrue(groups.members("bob").isEmpty());
        assertTrue(groups.members("nobody").isEmpty());
    }

    @Test
    void testLeaveSingleGroup() {
        GroupRegistry groups = new GroupRegistry();
        groups.join("alice", "c1");
        groups.join("bob", "c1");

        groups.leave("alice", "c1");

        assertTrue(groups.members("alice").isEmpty());
        assertEquals(Set.of("c1"), groups.members("bob"));
    }
}
