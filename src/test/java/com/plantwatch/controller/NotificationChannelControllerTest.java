package com.plantwatch.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.entity.ChannelKind;
import com.plantwatch.entity.NotificationChannel;
import com.plantwatch.repository.NotificationChannelRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@AutoConfigureTestDatabase
class NotificationChannelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private NotificationChannelRepository channelRepository;

    @Test
    void channelConfigIsValidatedPerKind() throws Exception {
        mockMvc.perform(post("/api/notification-channels").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"ops\",\"kind\":\"telegram\",\"destination\":\"garden\",\"config\":{\"chat_id\":\"42\"}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].msg", is("botToken is required")));

        mockMvc.perform(post("/api/notification-channels").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"ops\",\"kind\":\"pager\",\"destination\":\"garden\",\"config\":{}}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void kindCannotChangeAfterCreation() throws Exception {
        JsonNode channel = ApiTestSupport.postJson(mockMvc, objectMapper, "/api/notification-channels",
                "{\"name\":\"hook\",\"kind\":\"webhook\",\"destination\":\"garden\",\"config\":{\"url\":\"https://hooks.test/a\"}}");
        String id = channel.get("id").asText();

        mockMvc.perform(put("/api/notification-channels/{id}", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"discord\"}"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(put("/api/notification-channels/{id}", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled", is(false)))
                .andExpect(jsonPath("$.config.url", is("https://hooks.test/a")));

        mockMvc.perform(delete("/api/notification-channels/{id}", id)).andExpect(status().isOk());
        mockMvc.perform(delete("/api/notification-channels/{id}", id)).andExpect(status().isNotFound());
    }

    @Test
    void failedTestDeliveryIsBadGateway() throws Exception {
        JsonNode channel = ApiTestSupport.postJson(mockMvc, objectMapper, "/api/notification-channels",
                "{\"name\":\"bot\",\"kind\":\"telegram\",\"destination\":\"garden\","
                        + "\"config\":{\"bot_token\":\"123:abc\",\"chat_id\":\"42\"}}");

        mockMvc.perform(post("/api/notification-channels/{id}/test", channel.get("id").asText()))
                .andExpect(status().isBadGateway());
    }

    @Test
    void templatedWebhookUrlIsRejectedOnCreate() throws Exception {
        mockMvc.perform(post("/api/notification-channels").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"hook\",\"kind\":\"webhook\",\"destination\":\"garden\","
                                + "\"config\":{\"url\":\"http://hooks.test/{id}\"}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].msg", is("url must be an http(s) URL")));
    }

    @Test
    void storedWebhookWithUnusableUrlFailsTestAsBadGateway() throws Exception {
        NotificationChannel stored = channelRepository.save(NotificationChannel.builder()
                .name("legacy hook")
                .kind(ChannelKind.WEBHOOK)
                .destination("garden")
                .configJson("{\"url\":\"http://hooks.test/{id}\"}")
                .build());

        mockMvc.perform(post("/api/notification-channels/{id}/test", stored.getId()))
                .andExpect(status().isBadGateway());
    }

    @Test
    void testOfUnknownChannelIsNotFound() throws Exception {
        mockMvc.perform(post("/api/notification-channels/{id}/test", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }
}
