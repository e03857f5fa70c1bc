package ru.hedge.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import ru.hedge.dto.safety.EmergencyAction;

@Getter
@AllArgsConstructor
public class EmergencyEvent {
    private final EmergencyAction action;
}
