package com.plantwatch.service.notification;

import lombok.Value;

@Value
public class OutboundMessage {
    String subject;
    String body;
}
