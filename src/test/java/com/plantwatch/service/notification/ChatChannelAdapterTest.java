package com.plantwatch.service.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ChatChannelAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.createServer(restTemplate);
    }

    @Test
    void telegramPostsMarkdownToTheBotEndpoint() {
        TelegramChannelAdapter adapter = new TelegramChannelAdapter(restTemplate, objectMapper, "http://telegram.test");
        server.expect(requestTo("http://telegram.test/bot123:abc/sendMessage"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.chat_id").value("42"))
                .andExpect(jsonPath("$.text").value("*Dry soil*\nBasil is at 18%"))
                .andExpect(jsonPath("$.parse_mode").value("Markdown"))
                .andRespond(withSuccess());

        adapter.send(new OutboundMessage("Dry soil", "Basil is at 18%"), new TelegramChannelConfig("123:abc", "42"));

        server.verify();
    }

    @Test
    void discordPostsBoldSubjectAsContent() {
        DiscordChannelAdapter adapter = new DiscordChannelAdapter(restTemplate, objectMapper);
        String webhook = "https://discord.com/api/webhooks/1/token";
        server.expect(requestTo(webhook))
                .andExpect(jsonPath("$.content").value("**Dry soil**\nBasil is at 18%"))
                .andRespond(withSuccess());

        adapter.send(new OutboundMessage("Dry soil", "Basil is at 18%"), new DiscordChannelConfig(webhook));

        server.verify();
    }
}
