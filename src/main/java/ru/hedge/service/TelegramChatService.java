package ru.hedge.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import ru.hedge.config.TelegramBotConfig;
import ru.hedge.dto.cycle.CycleResult;
import ru.hedge.dto.safety.EmergencyAction;
import ru.hedge.dto.safety.EmergencyReason;
import ru.hedge.event.CycleFinishedEvent;
import ru.hedge.event.EmergencyEvent;
import ru.hedge.utils.ChatSubscribers;
import ru.hedge.utils.SafetyState;

@Slf4j
@Service
@AllArgsConstructor
@ConditionalOnProperty(prefix = "telegram", name = "enabled", havingValue = "true")
public class TelegramChatService extends TelegramLongPollingBot {

    private final TelegramBotConfig telegramBotConfig;
    private final ChatSubscribers subscribers;
    private final CycleOrchestrator orchestrator;
    private final SafetyMonitor safetyMonitor;

    @Override
    public String getBotUsername() {
        String username = telegramBotConfig.getBotUsername();
        return username.startsWith("@") ? username.substring(1) : username;
    }

    @Override
    public String getBotToken() {
        return telegramBotConfig.getBotToken();
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (update.hasMessage()) {
            Message message = update.getMessage();
            Long chatId = message.getChatId();

            if (message.hasText() && message.getText().startsWith("/")) {
                log.info("[Telegram] Command from {}: {}", chatId, message.getText());
                handleCommand(chatId, message.getText());
            }
        }
    }

    void handleCommand(Long chatId, String command) {
        String cmd = command.trim().split("\\s+", 2)[0].toLowerCase();

        switch (cmd) {
            case "/track" -> {
                subscribers.add(chatId);
                sendMessage(chatId, "🤖 *HedgeBot:* Subscribed to cycle notifications");
            }
            case "/untrack" -> subscribers.remove(chatId);
            case "/status" -> sendMessage(chatId, formatStatus());
            case "/stop" -> {
                safetyMonitor.getState().requestShutdown();
                sendMessage(chatId, "🤖 *HedgeBot:* Shutdown requested, the current cycle will finish first");
            }
            case "/emergency" -> {
                sendMessage(chatId, "🤖 *HedgeBot:* Manual emergency triggered, closing everything");
                safetyMonitor.executeEmergency(EmergencyReason.MANUAL_TRIGGER);
            }
            default -> sendMessage(chatId, "🤖 *HedgeBot:* Commands: /track /untrack /status /stop /emergency");
        }
    }

    public void sendMessage(Long chatId, String text) {
        SendMessage message = new SendMessage();
        message.setChatId(chatId);
        message.setText(text);
        message.setParseMode("Markdown");

        try {
            execute(message);
            log.info("Sent message to Telegram chat {}", chatId);
        } catch (TelegramApiException e) {
            log.error("Failed to send message to Telegram chat {}: {}", chatId, e.getMessage());
        }
    }

    @EventListener
    @Async
    public void handleCycleFinished(CycleFinishedEvent event) {
        String message = formatCycle(event.getResult());
        for (Long chatId : subscribers.getChatIds()) {
            sendMessage(chatId, message);
        }
    }

    @EventListener
    @Async
    public void handleEmergency(EmergencyEvent event) {
        log.warn("[Telegram] Emergency event: {}", event.getAction().getReason());
        String message = formatEmergency(event.getAction());
        for (Long chatId : subscribers.getChatIds()) {
            sendMessage(chatId, message);
        }
    }

    String formatStatus() {
        SafetyState state = safetyMonitor.getState();
        CycleResult last = orchestrator.getLastResult();
        return String.format(
                "🤖 *HedgeBot:* Status\n\n" +
                        "*State:* %s\n" +
                        "*Failures in a row:* %d\n" +
                        "*Emergency:* %s\n" +
                        "*Shutdown requested:* %s\n" +
                        "*Monitored:* %s\n" +
                        "*Last cycle:* %s",
                orchestrator.getCurrentState(),
                state.getConsecutiveFailures(),
                state.isEmergencyTriggered() ? "YES" : "no",
                state.isShutdownRequested() ? "yes" : "no",
                state.getMonitoredTokens().isEmpty() ? "-" : String.join(", ", state.getMonitoredTokens()),
                last == null ? "-" : last.getCycleId() + " " + (last.isSuccess() ? "✅" : "❌"));
    }

    String formatCycle(CycleResult result) {
        if (!result.isSuccess()) {
            return String.format(
                    "🤖 *HedgeBot:* Cycle Failed ❌\n\n" +
                            "*Cycle:* %s\n" +
                            "*Token:* %s\n" +
                            "*State:* %s\n" +
                            "*Error:* %s\n",
                    result.getCycleId(),
                    result.getToken(),
                    result.getState(),
                    result.getErrorMessage());
        }

        return String.format(
                "🤖 *HedgeBot:* Cycle Complete ✅\n\n" +
                        "*Cycle:* %s\n" +
                        "*Token:* %s\n" +
                        "*Size:* %s (%.2f USD)\n" +
                        "*Leverage:* %dx\n" +
                        "*Held:* %d min\n" +
                        "*Est. funding:* %.4f USD\n",
                result.getCycleId(),
                result.getToken(),
                result.getPositionSize(),
                result.getPositionValue(),
                result.getLeverage(),
                result.getHoldDurationSeconds() / 60,
                result.getFundingEarned());
    }

    String formatEmergency(EmergencyAction action) {
        return String.format(
                "🚨 *EMERGENCY* 🚨\n\n" +
                        "*Reason:* %s\n" +
                        "*Positions closed:* %d\n" +
                        "*Orders cancelled:* %d\n" +
                        "*Status:* %s",
                action.getReason(),
                action.getPositionsClosed().size(),
                action.getOrdersCancelled(),
                action.isSuccess() ? "Sweep complete" : "Manual check required!");
    }
}
