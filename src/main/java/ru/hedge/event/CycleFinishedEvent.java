package ru.hedge.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import ru.hedge.dto.cycle.CycleResult;

@Getter
@AllArgsConstructor
public class CycleFinishedEvent {
    private final CycleResult result;
}
