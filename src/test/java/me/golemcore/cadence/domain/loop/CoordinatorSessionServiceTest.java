package me.golemcore.cadence.domain.loop;

import me.golemcore.cadence.domain.model.ActionPlan;
import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.ActionType;
import me.golemcore.cadence.domain.model.ConversationHistory;
import me.golemcore.cadence.domain.service.ActionPlanner;
import me.golemcore.cadence.domain.service.ResponseComposer;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.ActionProviderPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CoordinatorSessionServiceTest {

    private static final Instant START = Instant.parse("2026-02-11T10:00:00Z");

    private ActionPlanner planner;
    private CoordinatorSessionService service;
    private final AtomicReference<Instant> now = new AtomicReference<>(START);

    @BeforeEach
    void setUp() {
        planner = mock(ActionPlanner.class);
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(invocation -> now.get());
        ResponseComposer responseComposer = mock(ResponseComposer.class);
        when(responseComposer.compose(anyString(), any(ActionPlan.class), anyList(), anyString())).thenReturn("ok");
        service = new CoordinatorSessionService(planner, mock(ActionProviderPort.class), responseComposer,
                new CadenceProperties(), clock);
    }

    @Test
    void shouldKeepPendingActionsPerSession() {
        ActionRequest reminder = ActionRequest.builder()
                .actionType(ActionType.SEND_REMINDER)
                .parameters(Map.of("patient_id", "PT-1"))
                .requiresApproval(true)
                .build();
        when(planner.plan(anyString(), anyMap(), any(ConversationHistory.class), eq("crc-a")))
                .thenReturn(ActionPlan.builder().actions(new ArrayList<>(List.of(reminder))).build());
        when(planner.plan(anyString(), anyMap(), any(ConversationHistory.class), eq("crc-b")))
                .thenReturn(ActionPlan.builder().responseTemplate("Hi").build());

        service.handleMessage("crc-a", "remind PT-1", Map.of());
        service.handleMessage("crc-b", "hello", Map.of());

        assertEquals(List.of(reminder), service.getPendingActions("crc-a"));
        assertTrue(service.getPendingActions("crc-b").isEmpty());
        assertEquals(2, service.getActiveSessionCount());
    }

    @Test
    void shouldReturnNoPendingActionsForUnknownSession() {
        assertTrue(service.getPendingActions("nobody").isEmpty());
        service.reset("nobody");
        assertEquals(0, service.getActiveSessionCount());
    }

    @Test
    void shouldRequireSessionId() {
        assertThrows(IllegalArgumentException.class, () -> service.handleMessage(" ", "hi", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> service.approvePending(null, 0));
    }

    @Test
    void shouldDropSessionStateOnClose() {
        ActionRequest reminder = ActionRequest.builder()
                .actionType(ActionType.SEND_REMINDER)
                .parameters(Map.of("patient_id", "PT-1"))
                .requiresApproval(true)
                .build();
        when(planner.plan(anyString(), anyMap(), any(ConversationHistory.class), eq("crc-a")))
                .thenReturn(ActionPlan.builder().actions(new ArrayList<>(List.of(reminder))).build());
        service.handleMessage("crc-a", "remind PT-1", Map.of());

        assertTrue(service.close("crc-a"));
        assertFalse(service.close("crc-a"));
        assertEquals(0, service.getActiveSessionCount());
        assertTrue(service.getPendingActions("crc-a").isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> service.approvePending("crc-a", 0));
    }

    @Test
    void shouldEvictOnlySessionsIdleBeyondTimeout() {
        when(planner.plan(anyString(), anyMap(), any(ConversationHistory.class), anyString()))
                .thenReturn(ActionPlan.builder().responseTemplate("Hi").build());
        service.handleMessage("crc-idle", "hello", Map.of());
        now.set(START.plus(Duration.ofMinutes(90)));
        service.handleMessage("crc-busy", "hello", Map.of());

        now.set(START.plus(Duration.ofMinutes(121)));
        int evicted = service.evictIdleSessions();

        assertEquals(1, evicted);
        assertEquals(1, service.getActiveSessionCount());
        assertTrue(service.close("crc-busy"));
        assertFalse(service.close("crc-idle"));
    }

    @Test
    void shouldKeepSessionAliveWhileItIsUsed() {
        when(planner.plan(anyString(), anyMap(), any(ConversationHistory.class), anyString()))
                .thenReturn(ActionPlan.builder().responseTemplate("Hi").build());
        service.handleMessage("crc-a", "hello", Map.of());
        now.set(START.plus(Duration.ofMinutes(100)));
        service.handleMessage("crc-a", "again", Map.of());

        now.set(START.plus(Duration.ofMinutes(200)));

        assertEquals(0, service.evictIdleSessions());
        assertEquals(1, service.getActiveSessionCount());
    }
}
