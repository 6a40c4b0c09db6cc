package org.nowstart.zonerisk.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "zonerisk")
public record ZoneRiskProperties(
        // 평가 대상 마켓 목록
        @NotEmpty @DefaultValue("KRW-BTC") List<String> markets,
        @Valid @NotNull @DefaultValue Upbit upbit,
        @Valid @NotNull @DefaultValue Clustering clustering,
        @Valid @NotNull @DefaultValue Touch touch,
        @Valid @NotNull @DefaultValue Scoring scoring,
        @Valid @NotNull @DefaultValue Regime regime,
        @Valid @NotNull @DefaultValue Risk risk,
        @Valid @NotNull @DefaultValue Evaluation evaluation,
        @Valid @NotNull @DefaultValue Sources sources,
        @Valid @NotNull @DefaultValue Persistence persistence
) {

    public record Upbit(
            // 업비트 REST API 기본 URL
            @NotBlank @DefaultValue("https://api.upbit.com") String baseUrl,
            // 연결 타임아웃
            @NotNull @DefaultValue("2s") Duration connectTimeout,
            // 응답 타임아웃
            @NotNull @DefaultValue("3s") Duration readTimeout
    ) {
    }

    public record Clustering(
            // 병합 반경 = ATR x 배수
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.5") BigDecimal mergeAtrMultiplier,
            // ATR 이 없을 때 사용할 가격 대비 병합 반경 비율
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.002") BigDecimal fallbackRadiusPct,
            // 관측되지 않은 존을 유지하는 평가 사이클 수
            @Positive @DefaultValue("3") int graceCycles
    ) {
    }

    public record Touch(
            // 터치 판정 거리 = ATR x 배수
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.3") BigDecimal touchAtrMultiplier,
            // 존별 터치 기록 보관 개수
            @Positive @DefaultValue("20") int historyWindow,
            // 후속 추세 판단에 사용할 캔들 수
            @Positive @DefaultValue("3") int followThroughCandles,
            // 거래량 평균 계산 구간
            @Positive @DefaultValue("20") int volumeLookback,
            // 틱 폴링 시 터치 판정에 넘길 완성 캔들의 타임프레임
            @NotNull @DefaultValue("M5") Timeframe candleTimeframe
    ) {
    }

    public record Scoring(
            // 신뢰 가능한 점수로 보기 위한 최소 터치 수
            @Positive @DefaultValue("2") int minConfidentTouches,
            // 터치 기록이 없을 때의 중립 반등 강도(0~10)
            @DecimalMin("0") @DecimalMax("10") @DefaultValue("5.0") BigDecimal neutralRejectionStrength
    ) {
    }

    public record Regime(
            // 1시간 변동률 극단 임계값
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.03") BigDecimal extremeChangeThreshold,
            // 5분 변동성 극단 임계값
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.03") BigDecimal extremeVolatilityThreshold,
            // 추세 판단용 EMA 길이(5분봉)
            @Positive @DefaultValue("50") int trendEmaLength,
            // 추세 밴드 비율
            @DecimalMin("0") @DecimalMax("0.999999") @DefaultValue("0.002") BigDecimal trendBand,
            // 레짐 입력 계산에 사용할 5분봉 수
            @Positive @DefaultValue("120") int candleCount
    ) {
    }

    public record Risk(
            @DecimalMin("0") @DefaultValue("0.001") BigDecimal tpBufferPct,
            @DecimalMin("0") @DefaultValue("0.002") BigDecimal slBufferPct,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.03") BigDecimal fallbackTpPct,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.02") BigDecimal fallbackSlPct,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.005") BigDecimal minSlPct,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.05") BigDecimal maxSlPct,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.005") BigDecimal minTpPct,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.10") BigDecimal maxTpPct,
            // 추세 순응 극단 장세의 TP 배수
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("2.5") BigDecimal alignedTpMultiplier,
            // 역추세 극단 장세의 TP/SL 배수
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.7") BigDecimal counterTrendTpMultiplier,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.75") BigDecimal counterTrendSlMultiplier,
            // 역추세/방향 불명 장세의 포지션 배수
            @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") @DefaultValue("0.5") BigDecimal reducedPositionMultiplier,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.1") BigDecimal minPositionMultiplier,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.0") BigDecimal maxPositionMultiplier,
            // 최소 손익비
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.0") BigDecimal minRiskRewardNormal,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.5") BigDecimal minRiskRewardAligned
    ) {
    }

    public record Evaluation(
            // 존 평가 사이클 주기
            @NotNull @DefaultValue("15m") Duration interval,
            // 가격 틱 폴링 주기
            @NotNull @DefaultValue("10s") Duration tickInterval,
            // 가격 틱 폴링 사용 여부(false 이면 API 로만 틱 수신)
            @DefaultValue("true") boolean tickPollingEnabled,
            // 레벨 소스별 타임아웃
            @NotNull @DefaultValue("5s") Duration sourceTimeout,
            // 레벨 소스 병렬 실행 스레드 수
            @Positive @DefaultValue("4") int sourceThreads,
            // 스냅샷이 바뀌었을 때 리스크 계산 재시도 횟수
            @Positive @DefaultValue("3") int maxEvaluationAttempts
    ) {
    }

    public record Sources(
            // 활성화할 레벨 소스 태그
            @NotEmpty @DefaultValue({"moving-average", "bollinger", "pivot", "swing", "volume-profile", "order-book"}) List<String> enabled,
            // 레벨을 수집할 타임프레임
            @NotEmpty @DefaultValue({"M15", "H1", "H4", "D1"}) List<Timeframe> timeframes,
            // 병합 반경/터치 판정에 사용할 ATR 타임프레임
            @NotNull @DefaultValue("H1") Timeframe atrTimeframe,
            // 호가 벽 레벨에 부여할 타임프레임
            @NotNull @DefaultValue("M15") Timeframe orderBookTimeframe,
            @Positive @DefaultValue("14") int atrPeriod,
            // 타임프레임별 조회 캔들 수
            @Positive @DefaultValue("200") int candleCount,
            @DecimalMin("0") @DefaultValue("0.8") BigDecimal sma50Weight,
            @DecimalMin("0") @DefaultValue("1.5") BigDecimal sma200Weight,
            @Positive @DefaultValue("20") int bollingerPeriod,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("2.0") BigDecimal bollingerStdDev,
            @DecimalMin("0") @DefaultValue("1.0") BigDecimal bollingerWeight,
            @DecimalMin("0") @DefaultValue("1.0") BigDecimal dailyPivotWeight,
            @DecimalMin("0") @DefaultValue("1.2") BigDecimal weeklyPivotWeight,
            // 스윙 포인트 판정 좌/우 캔들 수
            @Positive @DefaultValue("5") int swingLeftBars,
            @Positive @DefaultValue("5") int swingRightBars,
            @Positive @DefaultValue("100") int swingMaxAge,
            @DecimalMin("0") @DefaultValue("2.0") BigDecimal orderWallWeight,
            // 평균 호가 잔량 대비 벽 판정 배수
            @DecimalMin(value = "1") @DefaultValue("3.0") BigDecimal orderWallMultiple,
            // 거래량 프로파일 계산에 사용할 15분봉 수(24시간)
            @Positive @DefaultValue("96") int volumeProfileBars,
            // 가치 영역에 포함할 거래량 비율
            @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") @DefaultValue("0.70") BigDecimal valueAreaPct,
            @DecimalMin("0") @DefaultValue("1.3") BigDecimal vpocWeight,
            @DecimalMin("0") @DefaultValue("1.0") BigDecimal valueAreaWeight
    ) {
    }

    public record Persistence(
            // 터치 기록 저장 파일 경로
            @NotBlank @DefaultValue("data/touch-history.json") String path,
            // 저장 주기
            @NotNull @DefaultValue("10s") Duration flushInterval,
            // 가격 버킷 폭(로그 스케일 비율)
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.001") BigDecimal priceBucketPct
    ) {
    }
}
