package in.tradecore.service.execution;

import in.tradecore.domain.trade.Direction;

import java.math.BigDecimal;

/**
 * Everything needed to open a position once the entry order fills.
 *
 * @param referencePrice Price the decision was made at (signal close or retest touch)
 * @param source SIGNAL for direct entries, RETEST for retest fills
 */
public record EntryIntent(
    String symbol,
    Direction direction,
    int quantity,
    BigDecimal stopLoss,
    BigDecimal target,
    String strategyId,
    BigDecimal referencePrice,
    String source
) {}
