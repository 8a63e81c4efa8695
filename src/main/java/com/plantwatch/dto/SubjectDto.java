package com.plantwatch.dto;

import com.plantwatch.entity.Device;
import com.plantwatch.entity.Subject;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubjectDto {
    private UUID id;
    private String name;
    private String notes;
    private List<UUID> deviceIds;
    private Instant createdAt;

    public static SubjectDto from(Subject subject) {
        List<UUID> deviceIds = subject.getDevices().stream().map(Device::getId).sorted().collect(Collectors.toList());
        return new SubjectDto(subject.getId(), subject.getName(), subject.getNotes(), deviceIds,
                subject.getCreatedAt());
    }
}
