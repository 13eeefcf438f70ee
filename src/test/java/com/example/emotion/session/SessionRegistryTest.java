package com.example.emotion.session;

import com.example.emotion.config.EmotionAnalysisProperties;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class SessionRegistryTest {

    private SessionRegistry registry;

    @Before
    public void setUp() {
        registry = new SessionRegistry(new EmotionAnalysisProperties());
    }

    @Test
    public void testStartCreatesTrackingSession() {
        SessionState state = registry.start("s1");

        assertEquals("s1", state.getSessionId());
        assertEquals(SessionStatus.TRACKING, state.getStatus());
        assertNotNull(state.getStartedAt());
        assertSame(state, registry.require("s1"));
        assertEquals(1, registry.activeCount());
    }

    @Test
    public void testDoubleStartIsRejected() {
        SessionState first = registry.start("s1");
        try {
            registry.start("s1");
            fail("跟踪中的会话不能重复开始");
        } catch (SessionAlreadyActiveException expected) {
            assertEquals("s1", expected.getSessionId());
        }
        assertSame("原会话状态应保持不变", first, registry.require("s1"));
    }

    @Test
    public void testStartAfterStopReplacesState() {
        SessionState first = registry.start("s1");
        first.stop();

        SessionState second = registry.start("s1");

        assertNotSame(first, second);
        assertTrue(second.isTracking());
        assertEquals(SessionStatus.STOPPED, first.getStatus());
        assertNotNull(first.getStoppedAt());
    }

    @Test(expected = SessionNotFoundException.class)
    public void testRequireUnknownSession() {
        registry.require("missing");
    }

    @Test
    public void testDiscard() {
        registry.start("s1");

        assertTrue(registry.discard("s1"));
        assertFalse(registry.discard("s1"));
        assertFalse(registry.find("s1").isPresent());
        assertEquals(0, registry.size());
    }

    @Test
    public void testActiveCountIgnoresStoppedSessions() {
        registry.start("a");
        registry.start("b").stop();

        assertEquals(1, registry.activeCount());
        assertEquals(2, registry.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankSessionIdRejected() {
        registry.start("  ");
    }
}
