package com.hockeyquant.adapter.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Client for ESPN's league-wide NHL injury listing.
 */
@Component
public class EspnInjuryClient {

    private static final Logger log = LoggerFactory.getLogger(EspnInjuryClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public EspnInjuryClient(WebClient espnWebClient, ObjectMapper objectMapper) {
        this.webClient = espnWebClient;
        this.objectMapper = objectMapper;
    }

    public JsonNode getInjuries() {
        log.debug("Calling ESPN injuries endpoint");

        try {
            String response = webClient.get()
                    .uri("/injuries")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();

            if (response == null || response.isBlank()) {
                throw new EspnApiException("Empty response from ESPN injuries", null);
            }
            return objectMapper.readTree(response);
        } catch (WebClientResponseException e) {
            log.error("ESPN HTTP error: status={}, error={}", e.getStatusCode(), e.getMessage());
            throw e;
        } catch (EspnApiException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error calling ESPN injuries: {}", e.getMessage());
            throw new EspnApiException("Failed to call ESPN: " + e.getMessage(), e);
        }
    }

    public static class EspnApiException extends RuntimeException {
        public EspnApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
