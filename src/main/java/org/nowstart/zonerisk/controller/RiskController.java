package org.nowstart.zonerisk.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.zonerisk.data.dto.RiskCalculationRequest;
import org.nowstart.zonerisk.data.dto.TradeSignalRequest;
import org.nowstart.zonerisk.risk.RiskDecision;
import org.nowstart.zonerisk.risk.RiskParameterCalculator;
import org.nowstart.zonerisk.risk.RiskParameters;
import org.nowstart.zonerisk.service.MarketDataService;
import org.nowstart.zonerisk.service.RiskEvaluationService;
import org.nowstart.zonerisk.zone.core.Zone;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/risk")
@Tag(name = "Risk", description = "손절/익절 가격과 포지션 배수 계산 API")
public class RiskController {

    private final MarketDataService marketDataService;
    private final RiskEvaluationService riskEvaluationService;
    private final RiskParameterCalculator riskParameterCalculator;

    public RiskController(
            MarketDataService marketDataService,
            RiskEvaluationService riskEvaluationService,
            RiskParameterCalculator riskParameterCalculator
    ) {
        this.marketDataService = marketDataService;
        this.riskEvaluationService = riskEvaluationService;
        this.riskParameterCalculator = riskParameterCalculator;
    }

    @PostMapping("/{symbol}/decisions")
    @Operation(summary = "리스크 결정", description = "시그널을 현재 존 스냅샷과 시장 상태로 평가하여 승인/거절 결정을 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "평가 완료(승인 또는 거절)"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public RiskDecision decide(@PathVariable String symbol, @RequestBody @Valid TradeSignalRequest request) {
        return riskEvaluationService.evaluate(marketDataService.normalizeMarket(symbol), request.toSignal());
    }

    @PostMapping("/calculate")
    @Operation(summary = "리스크 파라미터 계산", description = "전달한 존 목록과 시장 상태로 손절/익절 가격을 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "계산 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "422", description = "손익비 최소 기준 미달")
    })
    public RiskParameters calculate(@RequestBody @Valid RiskCalculationRequest request) {
        List<Zone> zones = new ArrayList<>();
        List<RiskCalculationRequest.ZoneLevel> levels = request.zones() == null ? List.of() : request.zones();
        for (int i = 0; i < levels.size(); i++) {
            RiskCalculationRequest.ZoneLevel level = levels.get(i);
            zones.add(new Zone(
                    i + 1L,
                    level.price().doubleValue(),
                    0.0,
                    List.of(),
                    null,
                    null,
                    level.strengthScore().doubleValue(),
                    1,
                    List.of(),
                    false,
                    0
            ));
        }
        ZoneSnapshot snapshot = new ZoneSnapshot("request", 0L, null, Double.NaN, zones);
        return riskParameterCalculator.calculate(
                request.direction(),
                request.entryPrice().doubleValue(),
                request.condition(),
                snapshot
        );
    }
}
