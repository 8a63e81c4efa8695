package com.plantwatch.service.notification;

import com.plantwatch.exception.DispatchException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * JSON POST shared by the HTTP-based adapters. RestTemplate already raises on
 * 4xx/5xx; client errors and unusable target URLs become a {@link DispatchException}.
 */
final class HttpDelivery {

    private HttpDelivery() {
    }

    static void postJson(RestTemplate restTemplate, String url, String json, HttpHeaders extraHeaders, String what) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (extraHeaders != null) {
            headers.addAll(extraHeaders);
        }
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(json, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DispatchException(what + " answered " + response.getStatusCode().value());
            }
        } catch (RestClientException e) {
            throw new DispatchException(what + " delivery failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // URI template expansion or request setup rejected the target
            throw new DispatchException(what + " target is unusable: " + e.getMessage(), e);
        }
    }
}
