package ru.hedge.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradingEventLoggerTest {

    private final TradingEventLogger events = new TradingEventLogger(new ObjectMapper(),
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    void rendersFieldsInInsertionOrder() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", TradingEventLogger.POSITION_OPENED);
        payload.put("venue", "Extended");
        payload.put("size", 0.5);

        assertThat(events.render(payload)).isEqualTo("{\"event\":\"position_opened\",\"venue\":\"Extended\",\"size\":0.5}");
    }

    @Test
    void oddFieldListIsRejected() {
        assertThatThrownBy(() -> events.event(TradingEventLogger.CYCLE_START, "cycle_id"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
