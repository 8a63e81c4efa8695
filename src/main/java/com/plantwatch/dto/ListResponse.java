package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListResponse<T> {
    private List<T> data;
    private int count;

    public static <T> ListResponse<T> of(List<T> data) {
        return new ListResponse<>(data, data.size());
    }
}
