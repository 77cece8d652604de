package com.chronograph.core.logging;

import com.chronograph.core.model.Event;
import com.chronograph.core.model.InteractionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setEvent puts sessionId, agentId and eventType in MDC")
    void setEvent() {
        MdcContext.setEvent(Event.agentStart("S-1", "a-1", "coder"));
        assertEquals("S-1", MDC.get("sessionId"));
        assertEquals("a-1", MDC.get("agentId"));
        assertEquals("agent_start", MDC.get("eventType"));
    }

    @Test
    @DisplayName("setEvent leaves blank fields out")
    void setEventSkipsBlank() {
        MdcContext.setEvent(Event.agentStart("S-1", "a-1", "coder"));
        MdcContext.setEvent(Event.interaction("user", "A", "go", InteractionType.DELEGATION));
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("agentId"));
        assertEquals("interaction", MDC.get("eventType"));
    }

    @Test
    @DisplayName("clear removes all chronograph MDC keys")
    void clear() {
        MdcContext.setEvent(Event.agentStart("S-1", "a-1", "coder"));
        MdcContext.setSubscription("sub-1");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("eventType"));
        assertNull(MDC.get("subscriptionId"));
    }
}
