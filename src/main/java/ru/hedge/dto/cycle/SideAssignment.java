package ru.hedge.dto.cycle;

import lombok.Value;
import ru.hedge.dto.exchanges.Direction;

@Value
public class SideAssignment {
    Direction firstSide;
    Direction secondSide;

    public static SideAssignment firstLong() {
        return new SideAssignment(Direction.LONG, Direction.SHORT);
    }

    public static SideAssignment firstShort() {
        return new SideAssignment(Direction.SHORT, Direction.LONG);
    }

    public boolean isFirstShort() {
        return firstSide == Direction.SHORT;
    }
}
