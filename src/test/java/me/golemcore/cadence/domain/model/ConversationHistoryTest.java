package me.golemcore.cadence.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationHistoryTest {

    @Test
    void shouldDropOldestTurnsBeyondCap() {
        ConversationHistory history = new ConversationHistory(4);

        history.appendExchange("q1", "a1");
        history.appendExchange("q2", "a2");
        history.appendExchange("q3", "a3");

        List<ConversationTurn> turns = history.getTurns();
        assertEquals(4, turns.size());
        assertEquals("q2", turns.get(0).getContent());
        assertTrue(turns.get(0).isUser());
        assertEquals("a3", turns.get(3).getContent());
    }

    @Test
    void shouldReturnSnapshotOfTurns() {
        ConversationHistory history = new ConversationHistory(10);
        history.appendExchange("q1", "a1");

        List<ConversationTurn> snapshot = history.getTurns();
        history.appendExchange("q2", "a2");

        assertEquals(2, snapshot.size());
        assertEquals(4, history.size());
    }

    @Test
    void shouldRequireRoomForOneExchange() {
        assertThrows(IllegalArgumentException.class, () -> new ConversationHistory(1));
    }

    @Test
    void shouldClear() {
        ConversationHistory history = new ConversationHistory(10);
        history.appendExchange("q1", "a1");

        history.clear();

        assertEquals(0, history.size());
    }
}
