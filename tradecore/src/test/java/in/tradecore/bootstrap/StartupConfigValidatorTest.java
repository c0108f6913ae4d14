package in.tradecore.bootstrap;

import in.tradecore.config.EngineConfig;
import in.tradecore.config.TradingMode;
import in.tradecore.domain.common.EngineStartupException;
import in.tradecore.infrastructure.broker.data.MarketFeed;
import in.tradecore.infrastructure.broker.order.OrderGateway;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class StartupConfigValidatorTest {

    private final MarketFeed feed = mock(MarketFeed.class);
    private final OrderGateway gateway = mock(OrderGateway.class);

    @Test
    void testPaperDefaultsPass() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(EngineConfig.defaults(List.of("INFY")), null, feed));
    }

    @Test
    void testMissingSymbolsRefused() {
        EngineStartupException e = assertThrows(EngineStartupException.class,
            () -> StartupConfigValidator.validate(EngineConfig.defaults(List.of()), gateway, feed));
        assertTrue(e.getMessage().contains("symbols"));
    }

    @Test
    void testLiveWithoutGatewayRefused() {
        EngineConfig live = EngineConfig.defaults(List.of("INFY")).withTradingMode(TradingMode.LIVE);

        assertThrows(EngineStartupException.class, () -> StartupConfigValidator.validate(live, null, feed));
        assertDoesNotThrow(() -> StartupConfigValidator.validate(live, gateway, feed));
    }

    @Test
    void testMissingFeedRefused() {
        assertThrows(EngineStartupException.class,
            () -> StartupConfigValidator.validate(EngineConfig.defaults(List.of("INFY")), gateway, null));
    }
}
