package ru.hedge.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured trading events, one JSON object per log line on the "trading-events" logger.
 */
@Slf4j(topic = "trading-events")
public class TradingEventLogger {

    public static final String CYCLE_START = "cycle_start";
    public static final String CYCLE_END = "cycle_end";
    public static final String FUNDING_RATES = "funding_rates";
    public static final String POSITION_ASSIGNMENT = "position_assignment";
    public static final String SIZING_DECISION = "sizing_decision";
    public static final String POSITION_OPENED = "position_opened";
    public static final String POSITION_CLOSED = "position_closed";
    public static final String EMERGENCY = "emergency";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TradingEventLogger(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param keyValues alternating field names and values
     */
    public void event(String type, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Event fields must come in name/value pairs");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", type);
        payload.put("ts", clock.instant().toString());
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        log.info(render(payload));
    }

    String render(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize trading event {}: {}", payload.get("event"), e.getMessage());
            return payload.toString();
        }
    }
}
