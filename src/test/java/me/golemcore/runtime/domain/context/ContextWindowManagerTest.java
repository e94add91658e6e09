package me.golemcore.runtime.domain.context;

import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.RetentionConfig;
import me.golemcore.runtime.domain.model.RetentionPreference;
import me.golemcore.runtime.domain.model.RetentionStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextWindowManagerTest {

    private final ContextWindowManager manager = new ContextWindowManager(200000, 0.85, 3, 150);

    @Test
    void shouldComputeThresholdFromRatio() {
        assertEquals(170000, manager.thresholdTokens());
    }

    @Test
    void shouldCompactAtOrAboveThreshold() {
        assertTrue(manager.shouldCompact(171000));
        assertTrue(manager.shouldCompact(170000));
        assertFalse(manager.shouldCompact(169999));
        assertFalse(manager.shouldCompact(0));
    }

    @Test
    void shouldNotCompactTooShortHistory() {
        List<Message> twoMessages = List.of(Message.user("a"), Message.assistantText("b"));
        List<Message> threeMessages = List.of(Message.user("a"), Message.assistantText("b"), Message.user("c"));

        assertFalse(manager.shouldCompact(twoMessages, 180000));
        assertTrue(manager.shouldCompact(threeMessages, 180000));
        assertFalse(manager.shouldCompact(threeMessages, 100));
    }

    @Test
    void shouldNeverPreserveFewerThanThreeMessages() {
        assertEquals(3, manager.estimatePreservableCount(0));
        assertEquals(3, manager.estimatePreservableCount(300));
        assertEquals(10, manager.estimatePreservableCount(1500));
        assertEquals(50, manager.estimatePreservableCount(10000, 200));
    }

    @Test
    void shouldBuildAggressivePreset() {
        RetentionConfig config = manager.retentionFor(RetentionPreference.AGGRESSIVE);

        assertEquals(RetentionStrategy.PRESERVE_RECENT, config.getStrategy());
        assertEquals(140000, config.getMaxTokens());
        assertEquals(700, config.getPreserveCount());
    }

    @Test
    void shouldBuildBalancedAndConservativePresets() {
        assertEquals(RetentionStrategy.PRESERVE_IMPORTANT,
                manager.retentionFor(RetentionPreference.BALANCED).getStrategy());
        RetentionConfig conservative = manager.retentionFor(RetentionPreference.CONSERVATIVE);
        assertEquals(RetentionStrategy.SMART_COMPRESSION, conservative.getStrategy());
        assertEquals(140000 / 150, conservative.getPreserveCount());
    }

    @Test
    void shouldDerivePreserveCountWhenNotConfigured() {
        RetentionConfig derived = manager.retentionFor(RetentionStrategy.PRESERVE_RECENT, 0);
        RetentionConfig explicit = manager.retentionFor(RetentionStrategy.PRESERVE_RECENT, 7);

        assertEquals(140000 / 150, derived.getPreserveCount());
        assertEquals(7, explicit.getPreserveCount());
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new ContextWindowManager(0, 0.85, 3, 150));
        assertThrows(IllegalArgumentException.class, () -> new ContextWindowManager(1000, 1.5, 3, 150));
        assertThrows(IllegalArgumentException.class, () -> new ContextWindowManager(1000, 0.5, 3, 0));
    }
}
