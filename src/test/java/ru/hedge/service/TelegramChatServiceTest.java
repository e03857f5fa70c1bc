package ru.hedge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.hedge.config.TelegramBotConfig;
import ru.hedge.dto.cycle.CycleResult;
import ru.hedge.dto.cycle.CycleState;
import ru.hedge.dto.safety.EmergencyAction;
import ru.hedge.dto.safety.EmergencyReason;
import ru.hedge.event.CycleFinishedEvent;
import ru.hedge.utils.ChatSubscribers;
import ru.hedge.utils.SafetyState;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelegramChatServiceTest {

    @Mock
    private CycleOrchestrator orchestrator;
    @Mock
    private SafetyMonitor safetyMonitor;

    private final SafetyState state = new SafetyState();
    private final ChatSubscribers subscribers = new ChatSubscribers();
    private TelegramChatService bot;

    @BeforeEach
    void setUp() {
        TelegramBotConfig config = new TelegramBotConfig();
        config.setBotUsername("@hedge_bot");
        config.setBotToken("token");

        bot = spy(new TelegramChatService(config, subscribers, orchestrator, safetyMonitor));
        lenient().doNothing().when(bot).sendMessage(anyLong(), anyString());
        lenient().when(safetyMonitor.getState()).thenReturn(state);
    }

    @Test
    void usernameDropsLeadingAt() {
        assertThat(bot.getBotUsername()).isEqualTo("hedge_bot");
    }

    @Test
    void trackSubscribesChat() {
        bot.handleCommand(42L, "/track");

        assertThat(subscribers.isSubscribed(42L)).isTrue();
        bot.handleCommand(42L, "/untrack");
        assertThat(subscribers.isSubscribed(42L)).isFalse();
    }

    @Test
    void stopRequestsGracefulShutdown() {
        bot.handleCommand(1L, "/stop");

        assertThat(state.isShutdownRequested()).isTrue();
        assertThat(state.isEmergencyTriggered()).isFalse();
    }

    @Test
    void emergencyCommandRunsManualSweep() {
        bot.handleCommand(1L, "/emergency now");

        verify(safetyMonitor).executeEmergency(EmergencyReason.MANUAL_TRIGGER);
    }

    @Test
    void statusShowsMonitoredTokens() {
        state.addMonitoredToken("BTC");
        when(orchestrator.getCurrentState()).thenReturn(CycleState.HOLDING);

        assertThat(bot.formatStatus()).contains("HOLDING").contains("BTC");
    }

    @Test
    void finishedCycleIsSentToEverySubscriber() {
        subscribers.add(1L);
        subscribers.add(2L);
        CycleResult failed = CycleResult.builder()
                .cycleId("abcd1234")
                .success(false)
                .state(CycleState.ERROR)
                .token("ETH")
                .errorMessage("Sizing rejected")
                .build();

        bot.handleCycleFinished(new CycleFinishedEvent(failed));

        verify(bot).sendMessage(eq(1L), contains("Sizing rejected"));
        verify(bot).sendMessage(eq(2L), contains("Cycle Failed"));
    }

    @Test
    void emergencyMessageAsksForManualCheckOnFailure() {
        EmergencyAction action = EmergencyAction.builder()
                .reason(EmergencyReason.UNHEDGED_EXPOSURE)
                .timestamp(Instant.EPOCH)
                .positionsClosed(List.of("Extended:BTC-USD"))
                .ordersCancelled(0)
                .success(false)
                .details("")
                .build();

        assertThat(bot.formatEmergency(action))
                .contains("UNHEDGED_EXPOSURE")
                .contains("Manual check required");
    }
}
