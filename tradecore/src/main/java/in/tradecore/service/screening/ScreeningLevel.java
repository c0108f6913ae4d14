package in.tradecore.service.screening;

import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Position;

import java.util.List;

/**
 * One screening validator.
 *
 * Implementations return a result for both outcomes; an exception is recorded as an ERROR
 * outcome by the pipeline.
 */
public interface ScreeningLevel {

    String name();

    LevelSeverity severity();

    LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions);
}
