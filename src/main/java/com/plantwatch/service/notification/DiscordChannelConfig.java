package com.plantwatch.service.notification;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscordChannelConfig implements ChannelConfig {

    @JsonAlias("webhook_url")
    private String webhookUrl;

    @Override
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (ChannelConfig.isBlank(webhookUrl)) {
            problems.add("webhookUrl is required");
        } else if (!ChannelConfig.isHttpUrl(webhookUrl)) {
            problems.add("webhookUrl must be an http(s) URL");
        }
        return problems;
    }
}
