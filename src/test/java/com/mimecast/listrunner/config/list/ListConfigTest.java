package com.mimecast.listrunner.config.list;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ListConfigTest {

    @Test
    void defaults() {
        ListConfig policy = new ListConfig(Map.of());

        assertEquals("test", policy.getRealName("test"));
        assertEquals("lists.example.com", policy.getHostname("lists.example.com"));
        assertTrue(policy.isAdministrivia());
        assertEquals(40L, policy.getMaxMessageSizeKb());
        assertEquals(10, policy.getMaxNumRecipients());
        assertTrue(policy.isRequireExplicitDestination());
        assertEquals(NonMemberAction.HOLD, policy.getNonMemberAction());
        assertEquals(ModerationAction.HOLD, policy.getMemberModerationAction());
        assertEquals(SubscriptionPolicy.MODERATE, policy.getSubscribePolicy());
        assertEquals(SubscriptionPolicy.OPEN, policy.getUnsubscribePolicy());
        assertEquals(0, policy.getMaxHeldMessages());
        assertEquals(0, policy.getMaxDaysToHold());
        assertEquals(5.0, policy.getBounceScoreThreshold(), 0.0001);
        assertEquals(7, policy.getBounceInfoStaleAfterDays());
        assertEquals(3, policy.getBounceWarningsCount());
        assertTrue(policy.isBounceNotifyOwnerOnDisable());
        assertFalse(policy.isBounceNotifyOwnerOnIncrement());
        assertTrue(policy.getOwners().isEmpty());
    }

    @Test
    void readsListFile() throws IOException {
        ListConfig policy = new ListConfig("src/test/resources/lists/test/list.json5");

        assertEquals("Test", policy.getRealName("test"));
        assertEquals(List.of("owner@example.com"), policy.getOwners());
        assertEquals("secret", policy.getModeratorPassword());
        assertEquals(List.of("spammer@example.net"), policy.getNonMemberPatterns(NonMemberAction.DISCARD));
        assertTrue(policy.getNonMemberPatterns(NonMemberAction.REJECT).isEmpty());
        assertEquals("[Test] ", policy.getSubjectPrefix());
        assertEquals(SubscriptionPolicy.OPEN, policy.getSubscribePolicy());
    }

    @Test
    void enumValuesAreCaseInsensitive() {
        ListConfig policy = new ListConfig(Map.of(
                "nonMemberAction", " Reject ",
                "memberModerationAction", "nonsense",
                "subscribePolicy", "CLOSED"));

        assertEquals(NonMemberAction.REJECT, policy.getNonMemberAction());
        assertEquals(ModerationAction.HOLD, policy.getMemberModerationAction());
        assertEquals(SubscriptionPolicy.CLOSED, policy.getSubscribePolicy());
    }
}
