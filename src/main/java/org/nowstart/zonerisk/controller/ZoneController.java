package org.nowstart.zonerisk.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.zonerisk.data.dto.PriceUpdateRequest;
import org.nowstart.zonerisk.data.dto.PriceUpdateResultDto;
import org.nowstart.zonerisk.data.dto.ZoneSnapshotDto;
import org.nowstart.zonerisk.service.MarketDataService;
import org.nowstart.zonerisk.service.PriceTickService;
import org.nowstart.zonerisk.service.ZoneEvaluationWorkflowService;
import org.nowstart.zonerisk.service.ZoneReportService;
import org.nowstart.zonerisk.service.ZoneStateService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/zones")
@Tag(name = "Zones", description = "지지/저항 존 조회, 가격 틱 수신, 평가 사이클 실행 API")
public class ZoneController {

    private final MarketDataService marketDataService;
    private final ZoneStateService zoneStateService;
    private final ZoneReportService zoneReportService;
    private final PriceTickService priceTickService;
    private final ZoneEvaluationWorkflowService zoneEvaluationWorkflowService;

    public ZoneController(
            MarketDataService marketDataService,
            ZoneStateService zoneStateService,
            ZoneReportService zoneReportService,
            PriceTickService priceTickService,
            ZoneEvaluationWorkflowService zoneEvaluationWorkflowService
    ) {
        this.marketDataService = marketDataService;
        this.zoneStateService = zoneStateService;
        this.zoneReportService = zoneReportService;
        this.priceTickService = priceTickService;
        this.zoneEvaluationWorkflowService = zoneEvaluationWorkflowService;
    }

    @GetMapping("/{symbol}")
    @Operation(summary = "존 스냅샷 조회", description = "마켓의 현재 존 목록과 강도 점수, 터치 기록을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public ZoneSnapshotDto getZones(@PathVariable String symbol) {
        return ZoneSnapshotDto.from(zoneStateService.snapshot(marketDataService.normalizeMarket(symbol)));
    }

    @GetMapping("/{symbol}/report")
    @Operation(summary = "존 리포트 조회", description = "현재가 기준 가까운 지지/저항 존 요약을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public ZoneReportService.ZoneReport getReport(@PathVariable String symbol) {
        return zoneReportService.report(marketDataService.normalizeMarket(symbol));
    }

    @PostMapping("/{symbol}/ticks")
    @Operation(summary = "가격 틱 수신", description = "가격 업데이트를 반영하여 존 터치를 판정합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "반영 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public PriceUpdateResultDto pushTick(@PathVariable String symbol, @RequestBody @Valid PriceUpdateRequest request) {
        String market = marketDataService.normalizeMarket(symbol);
        ZoneStateService.TickUpdate update = priceTickService.accept(market, request.toCandle()).join();
        return new PriceUpdateResultDto(market, update.snapshot().version(), update.recorded());
    }

    @PostMapping("/{symbol}/evaluate")
    @Operation(summary = "존 평가 실행", description = "레벨 수집, 클러스터링, 존 갱신 사이클을 즉시 실행합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "실행 성공")
    })
    public ZoneEvaluationWorkflowService.CycleReport evaluate(@PathVariable String symbol) {
        return zoneEvaluationWorkflowService.evaluate(marketDataService.normalizeMarket(symbol));
    }
}
