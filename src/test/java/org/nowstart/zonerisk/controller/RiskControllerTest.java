package org.nowstart.zonerisk.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.zonerisk.ZoneRiskPropertiesFixture;
import org.nowstart.zonerisk.data.dto.RiskCalculationRequest;
import org.nowstart.zonerisk.data.dto.TradeSignalRequest;
import org.nowstart.zonerisk.data.type.AnchorType;
import org.nowstart.zonerisk.data.type.MarketCondition;
import org.nowstart.zonerisk.data.type.SignalConfidence;
import org.nowstart.zonerisk.data.type.SignalDirection;
import org.nowstart.zonerisk.risk.RiskDecision;
import org.nowstart.zonerisk.risk.RiskParameterCalculator;
import org.nowstart.zonerisk.risk.RiskParameters;
import org.nowstart.zonerisk.risk.TradeSignal;
import org.nowstart.zonerisk.service.MarketDataService;
import org.nowstart.zonerisk.service.RiskEvaluationService;

@ExtendWith(MockitoExtension.class)
class RiskControllerTest {

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private RiskEvaluationService riskEvaluationService;

    private RiskController controller;

    @BeforeEach
    void setUp() {
        controller = new RiskController(
                marketDataService,
                riskEvaluationService,
                new RiskParameterCalculator(ZoneRiskPropertiesFixture.defaults())
        );
    }

    @Test
    void decide_evaluatesSignalForNormalizedSymbol() {
        TradeSignal signal = new TradeSignal(SignalDirection.LONG, SignalConfidence.HIGH, 75_000.0);
        RiskDecision decision = RiskDecision.rejected(
                "KRW-BTC", signal, MarketCondition.NORMAL, RiskDecision.NO_PRICE, "no price", 0L, 1
        );
        when(marketDataService.normalizeMarket("krw-btc")).thenReturn("KRW-BTC");
        when(riskEvaluationService.evaluate("KRW-BTC", signal)).thenReturn(decision);

        RiskDecision result = controller.decide(
                "krw-btc",
                new TradeSignalRequest(SignalDirection.LONG, SignalConfidence.HIGH, new BigDecimal("75000"))
        );

        assertThat(result).isSameAs(decision);
        verify(riskEvaluationService).evaluate("KRW-BTC", signal);
    }

    @Test
    void calculate_anchorsOnSuppliedZones() {
        RiskParameters parameters = controller.calculate(new RiskCalculationRequest(
                SignalDirection.LONG,
                new BigDecimal("75000"),
                MarketCondition.NORMAL,
                List.of(
                        new RiskCalculationRequest.ZoneLevel(new BigDecimal("76000"), new BigDecimal("6")),
                        new RiskCalculationRequest.ZoneLevel(new BigDecimal("74500"), new BigDecimal("4"))
                )
        ));

        assertThat(parameters.tpPrice()).isCloseTo(75_924.0, within(1e-6));
        assertThat(parameters.slPrice()).isCloseTo(74_351.0, within(1e-6));
        assertThat(parameters.tpType()).isEqualTo(AnchorType.SR_LEVEL);
        assertThat(parameters.referenceZone().id()).isEqualTo(1L);
        assertThat(parameters.positionMultiplier()).isEqualTo(1.0);
    }

    @Test
    void calculate_fallsBackWithoutZones() {
        RiskParameters parameters = controller.calculate(new RiskCalculationRequest(
                SignalDirection.SHORT,
                new BigDecimal("100"),
                MarketCondition.EXTREME_VOLATILE,
                null
        ));

        assertThat(parameters.tpPrice()).isCloseTo(97.0, within(1e-9));
        assertThat(parameters.slPrice()).isCloseTo(102.0, within(1e-9));
        assertThat(parameters.slType()).isEqualTo(AnchorType.FALLBACK_PCT);
        assertThat(parameters.positionMultiplier()).isEqualTo(0.5);
    }
}
