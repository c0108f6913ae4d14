package in.tradecore.service.strategy;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.signal.Signal;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One strategy variant. Returns at most one signal per call.
 *
 * Implementations throw {@link in.tradecore.infrastructure.broker.data.InsufficientDataException}
 * when the bars cannot support a decision; the router skips the symbol for this cycle.
 */
public interface SignalGenerator {

    Optional<Signal> generate(String symbol, List<Bar> bars, Instant now);

    String strategyId();
}
