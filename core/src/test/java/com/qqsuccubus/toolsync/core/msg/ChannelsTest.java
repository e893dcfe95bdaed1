package com.qqsuccubus.toolsync.core.msg;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelsTest {

    @Test
    void testAllScopesPresent_ToolDeploymentSpaceInOrder() {
        assertEquals(
            List.of("tool:t1:updates", "deployment:d1:updates", "space:s1:tools"),
            Channels.channelsFor("t1", "d1", "s1", true)
        );
    }

    @Test
    void testSpaceBroadcastDisabled_OnlyToolChannel() {
        assertEquals(List.of("tool:t1:updates"), Channels.channelsFor("t1", null, "s1", false));
    }

    @Test
    void testBlankDeploymentAndSpace_Ignored() {
        assertEquals(List.of("tool:t1:updates"), Channels.channelsFor("t1", " ", "", true));
    }

    @Test
    void testDeploymentWithoutSpace() {
        assertEquals(
            List.of("tool:t1:updates", "deployment:d9:updates"),
            Channels.channelsFor("t1", "d9", null, true)
        );
    }

    @Test
    void testIsToolChannel() {
        assertTrue(Channels.isToolChannel(Channels.tool("abc")));
        assertFalse(Channels.isToolChannel(Channels.deployment("abc")));
        assertFalse(Channels.isToolChannel(null));
    }
}
