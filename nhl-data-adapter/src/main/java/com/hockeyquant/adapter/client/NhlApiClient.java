package com.hockeyquant.adapter.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.LocalDate;

/**
 * Client for the public NHL web API (api-web.nhle.com).
 * All methods return the raw JSON tree; mapping to value types happens in the providers.
 */
@Component
public class NhlApiClient {

    private static final Logger log = LoggerFactory.getLogger(NhlApiClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public NhlApiClient(WebClient nhlWebClient, ObjectMapper objectMapper) {
        this.webClient = nhlWebClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Current league standings
     */
    public JsonNode getStandings() {
        return callApi("/standings/now");
    }

    /**
     * Full season schedule for a club, including final scores of completed games
     *
     * @param seasonCode season code such as {@code 20252026}, or {@code now}
     */
    public JsonNode getClubSchedule(String team, String seasonCode) {
        return callApi("/club-schedule-season/{team}/{season}", team, seasonCode);
    }

    /**
     * League schedule for the week starting at the given date
     */
    public JsonNode getSchedule(LocalDate date) {
        return callApi("/schedule/{date}", date.toString());
    }

    /**
     * Scoreboard for a single date
     */
    public JsonNode getScore(LocalDate date) {
        return callApi("/score/{date}", date.toString());
    }

    /**
     * Throws WebClientResponseException for HTTP errors (4xx, 5xx).
     */
    public JsonNode callApi(String path, Object... uriVariables) {
        log.debug("Calling NHL API: path={}, vars={}", path, uriVariables);

        try {
            String response = webClient.get()
                    .uri(path, uriVariables)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();

            if (response == null || response.isBlank()) {
                throw new NhlApiException("Empty response from NHL API for " + path, null);
            }
            return objectMapper.readTree(response);
        } catch (WebClientResponseException e) {
            log.error("NHL API HTTP error: path={}, status={}, error={}",
                    path, e.getStatusCode(), e.getMessage());
            throw e;
        } catch (NhlApiException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error calling NHL API: path={}, error={}", path, e.getMessage());
            throw new NhlApiException("Failed to call NHL API: " + e.getMessage(), e);
        }
    }

    /**
     * Failure of an NHL API call that is not an HTTP error status
     */
    public static class NhlApiException extends RuntimeException {
        public NhlApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
