package org.nowstart.zonerisk.repository;

import java.util.List;
import org.nowstart.zonerisk.config.UpbitFeignConfig;
import org.nowstart.zonerisk.data.dto.UpbitCandleResponse;
import org.nowstart.zonerisk.data.dto.UpbitOrderbookResponse;
import org.nowstart.zonerisk.data.dto.UpbitTickerResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "upbitClient",
        url = "${zonerisk.upbit.base-url}",
        configuration = UpbitFeignConfig.class
)
public interface UpbitFeignClient {

    @GetMapping("/v1/candles/minutes/{unit}")
    List<UpbitCandleResponse> getMinuteCandles(
            @PathVariable("unit") int unit,
            @RequestParam("market") String market,
            @RequestParam("count") int count
    );

    @GetMapping("/v1/candles/days")
    List<UpbitCandleResponse> getDayCandles(
            @RequestParam("market") String market,
            @RequestParam("count") int count
    );

    @GetMapping("/v1/candles/weeks")
    List<UpbitCandleResponse> getWeekCandles(
            @RequestParam("market") String market,
            @RequestParam("count") int count
    );

    @GetMapping("/v1/ticker")
    List<UpbitTickerResponse> getTickers(@RequestParam("markets") String markets);

    @GetMapping("/v1/orderbook")
    List<UpbitOrderbookResponse> getOrderbooks(@RequestParam("markets") String markets);
}
