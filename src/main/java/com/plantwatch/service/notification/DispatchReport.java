package com.plantwatch.service.notification;

import lombok.Value;

@Value
public class DispatchReport {
    int delivered;
    int failed;

    public static DispatchReport empty() {
        return new DispatchReport(0, 0);
    }
}
