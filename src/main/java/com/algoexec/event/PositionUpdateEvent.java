package com.algoexec.event;

import com.algoexec.domain.model.Position;
import java.util.Map;

/** Published after positions change. Carries the full position book, keyed by ticker. */
public class PositionUpdateEvent extends PortfolioEvent {

    private final Map<String, Position> positions;

    public PositionUpdateEvent(Object source, Map<String, Position> positions) {
        super(source, PortfolioEventType.POSITION_UPDATE);
        this.positions = Map.copyOf(positions);
    }

    public Map<String, Position> getPositions() {
        return positions;
    }
}
