package com.plantwatch.service.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookChannelConfig implements ChannelConfig {

    private String url;

    // Optional; when set, requests carry an HMAC-SHA256 signature header
    private String secret;

    @Override
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (ChannelConfig.isBlank(url)) {
            problems.add("url is required");
        } else if (!ChannelConfig.isHttpUrl(url)) {
            problems.add("url must be an http(s) URL");
        }
        return problems;
    }
}
