package in.tradecore.service.screening.level;

import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Position;
import in.tradecore.service.screening.MarketState;

import java.util.List;

public final class RiskRewardLevel extends AbstractScreeningLevel {

    public static final String NAME = "RISK_REWARD";

    private final double minRewardToRisk;

    public RiskRewardLevel(double minRewardToRisk) {
        super(NAME, LevelSeverity.ADVISORY);
        this.minRewardToRisk = minRewardToRisk;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        if (signal.target() == null) {
            return fail("Signal has no target");
        }
        double rr = signal.rewardToRisk();
        if (rr < minRewardToRisk) {
            return fail(String.format("Reward:risk %.2f below minimum %.2f", rr, minRewardToRisk));
        }
        return pass(String.format("Reward:risk %.2f", rr));
    }
}
