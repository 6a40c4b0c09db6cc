package org.nowstart.zonerisk.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.zonerisk.data.dto.RegimeClassificationDto;
import org.nowstart.zonerisk.data.dto.RegimeClassifyRequest;
import org.nowstart.zonerisk.data.type.MarketCondition;
import org.nowstart.zonerisk.regime.MarketRegimeClassifier;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/regime")
@Tag(name = "Regime", description = "시장 상태 분류 API")
public class RegimeController {

    private final MarketRegimeClassifier marketRegimeClassifier;

    public RegimeController(MarketRegimeClassifier marketRegimeClassifier) {
        this.marketRegimeClassifier = marketRegimeClassifier;
    }

    @PostMapping("/classify")
    @Operation(summary = "시장 상태 분류", description = "1시간 변동률, 5분 변동성, 추세 방향으로 시장 상태를 분류합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "분류 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public RegimeClassificationDto classify(@RequestBody @Valid RegimeClassifyRequest request) {
        MarketCondition condition = marketRegimeClassifier.classify(
                request.priceChange1h().doubleValue(),
                request.volatility5m().doubleValue(),
                request.trend()
        );
        return new RegimeClassificationDto(condition, request.priceChange1h(), request.volatility5m(), request.trend());
    }
}
