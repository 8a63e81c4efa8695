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
public class TelegramChannelConfig implements ChannelConfig {

    @JsonAlias("bot_token")
    private String botToken;

    @JsonAlias("chat_id")
    private String chatId;

    @Override
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (ChannelConfig.isBlank(botToken)) {
            problems.add("botToken is required");
        }
        if (ChannelConfig.isBlank(chatId)) {
            problems.add("chatId is required");
        }
        return problems;
    }
}
