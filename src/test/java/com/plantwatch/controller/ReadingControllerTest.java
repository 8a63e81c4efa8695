package com.plantwatch.controller;

import com.plantwatch.entity.Device;
import com.plantwatch.repository.DeviceRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@AutoConfigureTestDatabase
class ReadingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DeviceRepository deviceRepository;

    @Test
    void ingestCreatesDeviceAndStoresEveryReading() throws Exception {
        mockMvc.perform(post("/api/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ApiTestSupport.batch("10:00:00:00:00:01",
                                "[{\"kind\":\"temperature\",\"value\":21.5},{\"kind\":\"humidity\",\"value\":48}]")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.inserted", is(2)))
                .andExpect(jsonPath("$.alertsTriggered", is(0)));

        Device device = deviceRepository.findByMacAddress("100000000001").orElseThrow();

        mockMvc.perform(get("/api/readings").param("deviceId", device.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(2)))
                .andExpect(jsonPath("$.data", hasSize(2)));

        mockMvc.perform(get("/api/readings")
                        .param("deviceId", device.getId().toString())
                        .param("kind", "humidity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(1)))
                .andExpect(jsonPath("$.data[0].value", is(48.0)));
    }

    @Test
    void repeatedContactReusesTheDevice() throws Exception {
        String readings = "[{\"kind\":\"light_lux\",\"value\":1200}]";
        mockMvc.perform(post("/api/readings").contentType(MediaType.APPLICATION_JSON)
                        .content(ApiTestSupport.batch("10-00-00-00-00-02", readings)))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/readings").contentType(MediaType.APPLICATION_JSON)
                        .content(ApiTestSupport.batch("100000000002", readings)))
                .andExpect(status().isCreated());

        Device device = deviceRepository.findByMacAddress("100000000002").orElseThrow();
        mockMvc.perform(get("/api/readings").param("deviceId", device.getId().toString()))
                .andExpect(jsonPath("$.count", is(2)));
    }

    @Test
    void unknownKindIsRejectedWithLocation() throws Exception {
        mockMvc.perform(post("/api/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ApiTestSupport.batch("100000000003",
                                "[{\"kind\":\"temperature\",\"value\":21.5},{\"kind\":\"radiation\",\"value\":1}]")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].loc[0]", is("body")))
                .andExpect(jsonPath("$.detail[0].loc[1]", is("readings")))
                .andExpect(jsonPath("$.detail[0].loc[2]", is(1)))
                .andExpect(jsonPath("$.detail[0].loc[3]", is("kind")));

        assertThat(deviceRepository.findByMacAddress("100000000003")).isEmpty();
    }

    @Test
    void malformedJsonIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/readings").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].loc[0]", is("body")));
    }

    @Test
    void searchNeedsDeviceId() throws Exception {
        mockMvc.perform(get("/api/readings"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].loc[1]", is("deviceId")));
    }

    @Test
    void limitAboveMaximumIsRejected() throws Exception {
        mockMvc.perform(get("/api/readings")
                        .param("deviceId", "00000000-0000-0000-0000-000000000000")
                        .param("limit", "5000"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void trendOfUnknownDeviceIsNotFound() throws Exception {
        mockMvc.perform(get("/api/readings/trends")
                        .param("deviceId", "00000000-0000-0000-0000-000000000000")
                        .param("kind", "temperature"))
                .andExpect(status().isNotFound());
    }

    @Test
    void healthAnswersOnBothPaths() throws Exception {
        mockMvc.perform(get("/health")).andExpect(status().isOk()).andExpect(jsonPath("$.status", is("ok")));
        mockMvc.perform(get("/api/health")).andExpect(status().isOk());
    }
}
