package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubjectRequest {
    private String name;
    private String notes;
    // Only used by POST /subjects/{id}/devices
    private UUID deviceId;
}
