package com.plantwatch.service;

import com.plantwatch.dto.TrendResponse;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Reading;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.repository.DeviceRepository;
import com.plantwatch.repository.ReadingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrendAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-06-08T12:00:00Z");
    private static final Instant START = NOW.minus(Duration.ofDays(7));

    @Mock
    private DeviceRepository deviceRepository;
    @Mock
    private ReadingRepository readingRepository;

    private TrendAggregator aggregator;
    private Device device;

    @BeforeEach
    void setUp() {
        aggregator = new TrendAggregator(deviceRepository, readingRepository, Clock.fixed(NOW, ZoneOffset.UTC), 2.0);
        device = Device.builder().id(UUID.randomUUID()).macAddress("AABBCCDDEEFF").resolutionBits(10).build();
    }

    @Test
    void risingTemperatureIsUp() {
        stubWindows(
                List.of(temp(22.0, START.plus(Duration.ofHours(1))), temp(24.0, START.plus(Duration.ofHours(2))),
                        temp(26.0, START.plus(Duration.ofDays(1)))),
                List.of(temp(20.0, START.minus(Duration.ofDays(3)))));

        TrendResponse trend = aggregator.trend(device.getId(), "temperature", "7d");

        assertThat(trend.getPeriodDays()).isEqualTo(7);
        assertThat(trend.getCurrentAvg()).isEqualTo(24.0);
        assertThat(trend.getPreviousAvg()).isEqualTo(20.0);
        assertThat(trend.getChangePct()).isEqualTo(20.0);
        assertThat(trend.getDirection()).isEqualTo("up");
        assertThat(trend.getPoints()).hasSize(2);
        assertThat(trend.getPoints().get(0).getDay()).isEqualTo(START);
        assertThat(trend.getPoints().get(0).getAvg()).isEqualTo(23.0);
        assertThat(trend.getPoints().get(0).getCount()).isEqualTo(2);
        assertThat(trend.getPoints().get(1).getDay()).isEqualTo(START.plus(Duration.ofDays(1)));
    }

    @Test
    void zeroPreviousAverageIsStableWithoutChange() {
        stubWindows(List.of(temp(5.0, START.plus(Duration.ofHours(1)))),
                List.of(temp(0.0, START.minus(Duration.ofDays(1)))));

        TrendResponse trend = aggregator.trend(device.getId(), "temperature", "7d");

        assertThat(trend.getPreviousAvg()).isEqualTo(0.0);
        assertThat(trend.getChangePct()).isNull();
        assertThat(trend.getDirection()).isEqualTo("stable");
    }

    @Test
    void emptyHistoryIsStable() {
        stubWindows(List.of(), List.of());

        TrendResponse trend = aggregator.trend(device.getId(), "temperature", "7d");

        assertThat(trend.getPoints()).isEmpty();
        assertThat(trend.getCurrentAvg()).isZero();
        assertThat(trend.getPreviousAvg()).isNull();
        assertThat(trend.getDirection()).isEqualTo("stable");
    }

    @Test
    void smallChangeStaysStable() {
        assertThat(aggregator.direction(1.9)).isEqualTo("stable");
        assertThat(aggregator.direction(-2.5)).isEqualTo("down");
        assertThat(aggregator.direction(2.1)).isEqualTo("up");
    }

    @Test
    void periodParsing() {
        assertThat(TrendAggregator.parsePeriod("7d")).isEqualTo(7);
        assertThat(TrendAggregator.parsePeriod("30")).isEqualTo(30);
        assertThatThrownBy(() -> TrendAggregator.parsePeriod("0d")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> TrendAggregator.parsePeriod("1w")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> TrendAggregator.parsePeriod("400d")).isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownDeviceIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(deviceRepository.findWithProfilesById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> aggregator.trend(missing, "temperature", "7d")).isInstanceOf(NotFoundException.class);
    }

    private void stubWindows(List<Reading> current, List<Reading> previous) {
        when(deviceRepository.findWithProfilesById(device.getId())).thenReturn(Optional.of(device));
        when(readingRepository.findWindow(eq(device.getId()), eq(MeasurementKind.TEMPERATURE), eq(START), any()))
                .thenReturn(current);
        when(readingRepository.findWindow(eq(device.getId()), eq(MeasurementKind.TEMPERATURE), any(), eq(START)))
                .thenReturn(previous);
    }

    private Reading temp(double value, Instant at) {
        return Reading.builder().device(device).kind(MeasurementKind.TEMPERATURE).value(value).recordedAt(at).build();
    }
}
