package com.hockeyquant.adapter.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Downloads MoneyPuck regular-season summary CSVs.
 */
@Component
public class MoneyPuckClient {

    private static final Logger log = LoggerFactory.getLogger(MoneyPuckClient.class);

    private final WebClient webClient;

    public MoneyPuckClient(WebClient moneyPuckWebClient) {
        this.webClient = moneyPuckWebClient;
    }

    public String getTeamsCsv(int seasonStartYear) {
        return download(seasonStartYear, "teams");
    }

    public String getGoaliesCsv(int seasonStartYear) {
        return download(seasonStartYear, "goalies");
    }

    public String getSkatersCsv(int seasonStartYear) {
        return download(seasonStartYear, "skaters");
    }

    private String download(int seasonStartYear, String table) {
        log.debug("Downloading MoneyPuck table: season={}, table={}", seasonStartYear, table);

        try {
            String body = webClient.get()
                    .uri("/{season}/regular/{table}.csv", seasonStartYear, table)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();

            if (body == null || body.isBlank()) {
                throw new MoneyPuckException("Empty " + table + ".csv for season " + seasonStartYear, null);
            }
            log.debug("MoneyPuck {}.csv received: {} chars", table, body.length());
            return body;
        } catch (WebClientResponseException e) {
            log.error("MoneyPuck HTTP error: table={}, status={}", table, e.getStatusCode());
            throw e;
        } catch (MoneyPuckException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error downloading MoneyPuck table: table={}, error={}", table, e.getMessage());
            throw new MoneyPuckException("Failed to download " + table + ".csv: " + e.getMessage(), e);
        }
    }

    public static class MoneyPuckException extends RuntimeException {
        public MoneyPuckException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
