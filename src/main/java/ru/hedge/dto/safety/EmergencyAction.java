package ru.hedge.dto.safety;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class EmergencyAction {
    EmergencyReason reason;
    Instant timestamp;
    List<String> positionsClosed;
    int ordersCancelled;
    boolean success;
    String details;
}
