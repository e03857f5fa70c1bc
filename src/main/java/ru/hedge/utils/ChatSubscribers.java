package ru.hedge.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Telegram chats that receive cycle and emergency notifications.
 */
@Slf4j
@Component
public class ChatSubscribers {

    private final Set<Long> chatIds = ConcurrentHashMap.newKeySet();

    public void add(Long chatId) {
        if (chatIds.add(chatId)) {
            log.info("New subscriber added: {}", chatId);
        } else {
            log.info("User {} already subscribed", chatId);
        }
    }

    public void remove(Long chatId) {
        if (chatIds.remove(chatId)) {
            log.info("Subscriber removed: {}", chatId);
        }
    }

    public Set<Long> getChatIds() {
        return Collections.unmodifiableSet(chatIds);
    }

    public boolean isSubscribed(Long chatId) {
        return chatIds.contains(chatId);
    }
}
