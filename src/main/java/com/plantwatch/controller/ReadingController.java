package com.plantwatch.controller;

import com.plantwatch.dto.IngestRequest;
import com.plantwatch.dto.IngestResult;
import com.plantwatch.dto.ListResponse;
import com.plantwatch.dto.ReadingDto;
import com.plantwatch.dto.TrendResponse;
import com.plantwatch.service.IngestionService;
import com.plantwatch.service.ReadingQueryService;
import com.plantwatch.service.TrendAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/readings")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ReadingController {

    private final IngestionService ingestionService;
    private final ReadingQueryService readingQueryService;
    private final TrendAggregator trendAggregator;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public IngestResult ingest(@RequestBody IngestRequest request) {
        return ingestionService.ingest(request);
    }

    @GetMapping
    public ListResponse<ReadingDto> getReadings(
            @RequestParam UUID deviceId,
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return readingQueryService.search(deviceId, kind, from, to, limit, offset);
    }

    @GetMapping("/trends")
    public TrendResponse getTrend(@RequestParam UUID deviceId,
                                  @RequestParam String kind,
                                  @RequestParam(defaultValue = "7d") String period) {
        return trendAggregator.trend(deviceId, kind, period);
    }
}
