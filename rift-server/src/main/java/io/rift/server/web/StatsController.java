package io.rift.server.web;

import io.rift.server.api.CurrentStatsResponse;
import io.rift.server.service.StatsService;
import io.rift.stats.DailyStats;
import io.rift.stats.StatsAggregator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequestMapping("/stats")
public class StatsController {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping("/current")
    public CurrentStatsResponse current() {
        return CurrentStatsResponse.from(statsService.current());
    }

    /**
     * Per-day totals, newest first. Days without events are left out.
     */
    @GetMapping("/daily")
    public List<DailyStats> daily(@RequestParam(defaultValue = "7")
                                  @Min(1) @Max(StatsAggregator.MAX_DAYS) int days) {
        return statsService.daily(days);
    }
}
