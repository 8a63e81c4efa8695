package com.plantwatch.service;

import com.plantwatch.dto.TrendPoint;
import com.plantwatch.dto.TrendResponse;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Reading;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.repository.DeviceRepository;
import com.plantwatch.repository.ReadingRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Day-bucketed history of one kind plus a comparison with the preceding
 * period of the same length.
 */
@Service
public class TrendAggregator {

    static final int MAX_PERIOD_DAYS = 365;
    private static final Pattern PERIOD = Pattern.compile("^(\\d{1,3})[dD]?$");

    private final DeviceRepository deviceRepository;
    private final ReadingRepository readingRepository;
    private final Clock clock;
    private final double stableThresholdPct;

    public TrendAggregator(DeviceRepository deviceRepository,
                           ReadingRepository readingRepository,
                           Clock clock,
                           @Value("${garden.trends.stable-threshold-pct:2.0}") double stableThresholdPct) {
        this.deviceRepository = deviceRepository;
        this.readingRepository = readingRepository;
        this.clock = clock;
        this.stableThresholdPct = stableThresholdPct;
    }

    @Transactional(readOnly = true)
    public TrendResponse trend(UUID deviceId, String kindCode, String period) {
        MeasurementKind kind = MeasurementKind.fromCode(kindCode).orElseThrow(() -> new ValidationException(
                List.of("query", "kind"), "unknown kind '" + kindCode + "'", "value_error.kind"));
        int periodDays = parsePeriod(period);
        Device device = deviceRepository.findWithProfilesById(deviceId)
                .orElseThrow(() -> NotFoundException.of("Device", deviceId));

        Instant now = clock.instant();
        Duration span = Duration.ofDays(periodDays);
        Instant start = now.minus(span);
        List<Reading> current = readingRepository.findWindow(deviceId, kind, start, now);
        List<Reading> previous = readingRepository.findWindow(deviceId, kind, start.minus(span), start);

        Map<Long, DoubleSummaryStatistics> buckets = new TreeMap<>();
        DoubleSummaryStatistics currentStats = new DoubleSummaryStatistics();
        for (Reading reading : current) {
            double value = Calibration.percentFor(device, kind, reading.getValue());
            long bucket = Duration.between(start, reading.getRecordedAt()).toDays();
            buckets.computeIfAbsent(bucket, b -> new DoubleSummaryStatistics()).accept(value);
            currentStats.accept(value);
        }
        DoubleSummaryStatistics previousStats = new DoubleSummaryStatistics();
        for (Reading reading : previous) {
            previousStats.accept(Calibration.percentFor(device, kind, reading.getValue()));
        }

        List<TrendPoint> points = new ArrayList<>();
        buckets.forEach((bucket, stats) -> points.add(new TrendPoint(
                start.plus(Duration.ofDays(bucket)),
                round(stats.getAverage(), 2),
                round(stats.getMin(), 2),
                round(stats.getMax(), 2),
                (int) stats.getCount())));

        double currentAvg = currentStats.getCount() > 0 ? currentStats.getAverage() : 0.0;
        Double previousAvg = previousStats.getCount() > 0 ? previousStats.getAverage() : null;
        Double changePct = null;
        if (previousAvg != null && previousAvg != 0.0) {
            changePct = round((currentAvg - previousAvg) / Math.abs(previousAvg) * 100.0, 1);
        }

        return TrendResponse.builder()
                .kind(kind)
                .periodDays(periodDays)
                .points(points)
                .currentAvg(round(currentAvg, 2))
                .previousAvg(previousAvg != null ? round(previousAvg, 2) : null)
                .direction(direction(changePct))
                .changePct(changePct)
                .build();
    }

    String direction(Double changePct) {
        if (changePct == null) {
            return "stable";
        }
        if (changePct > stableThresholdPct) {
            return "up";
        }
        if (changePct < -stableThresholdPct) {
            return "down";
        }
        return "stable";
    }

    static int parsePeriod(String period) {
        String text = period == null ? "" : period.trim();
        Matcher matcher = PERIOD.matcher(text);
        if (matcher.matches()) {
            int days = Integer.parseInt(matcher.group(1));
            if (days >= 1 && days <= MAX_PERIOD_DAYS) {
                return days;
            }
        }
        throw new ValidationException(List.of("query", "period"),
                "period must be a number of days between 1 and " + MAX_PERIOD_DAYS + ", e.g. 7d", "value_error.period");
    }

    static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }
}
