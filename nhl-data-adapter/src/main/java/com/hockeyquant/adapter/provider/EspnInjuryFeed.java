package com.hockeyquant.adapter.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.hockeyquant.adapter.client.EspnInjuryClient;
import com.hockeyquant.adapter.config.DataSourceProperties;
import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.InjuryReport;
import com.hockeyquant.adapter.model.InjurySnapshotDocument;
import com.hockeyquant.adapter.model.NhlTeam;
import com.hockeyquant.adapter.repository.InjurySnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link InjuryFeed} over ESPN's injury listing.
 *
 * <p>Keeps the latest snapshot in memory and mirrors it to MongoDB. A snapshot older
 * than {@code hockeyquant.sources.injury-ttl} is refreshed on the next lookup; when a
 * refresh fails the previous snapshot keeps being served.
 */
@Service
public class EspnInjuryFeed implements InjuryFeed {

    private static final Logger log = LoggerFactory.getLogger(EspnInjuryFeed.class);

    // Minimum gap between automatic refresh attempts after a failure
    static final Duration RETRY_BACKOFF = Duration.ofMinutes(5);

    private final EspnInjuryClient client;
    private final InjurySnapshotRepository repository;
    private final DataSourceProperties properties;
    private final Clock clock;

    private volatile Snapshot snapshot;
    private Instant lastAttempt;

    public EspnInjuryFeed(EspnInjuryClient client, InjurySnapshotRepository repository,
                          DataSourceProperties properties, Clock clock) {
        this.client = client;
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized FetchResult<Map<String, InjuryReport>> refresh() {
        Instant now = clock.instant();
        lastAttempt = now;
        try {
            Map<String, InjuryReport> reports = parse(client.getInjuries(), now);
            snapshot = new Snapshot(reports, now);
            persist(reports);
            log.info("Injury feed refreshed: {} teams with injuries", reports.size());
            return FetchResult.success(reports);
        } catch (Exception e) {
            log.warn("Injury refresh failed, keeping previous snapshot: {}", e.getMessage());
            return FetchResult.failure(FetchErrors.classify("ESPN injuries", e));
        }
    }

    @Override
    public List<String> getInjuries(String team) {
        Snapshot current = currentSnapshot();
        if (current == null) {
            return List.of();
        }
        InjuryReport report = current.reports().get(team);
        return report == null ? List.of() : report.players();
    }

    private synchronized Snapshot currentSnapshot() {
        if (snapshot == null) {
            snapshot = loadPersisted().orElse(null);
        }
        if ((snapshot == null || isStale(snapshot)) && mayRetry()) {
            refresh();
        }
        return snapshot;
    }

    private boolean mayRetry() {
        return lastAttempt == null || !lastAttempt.plus(RETRY_BACKOFF).isAfter(clock.instant());
    }

    private boolean isStale(Snapshot s) {
        return s.fetchedAt().plus(properties.getInjuryTtl()).isBefore(clock.instant());
    }

    private Optional<Snapshot> loadPersisted() {
        Instant since = clock.instant().minus(properties.getInjuryTtl());
        try {
            List<InjurySnapshotDocument> docs = repository.findByFetchedAtAfter(since);
            if (docs.isEmpty()) {
                return Optional.empty();
            }
            Map<String, InjuryReport> reports = new HashMap<>();
            Instant oldest = null;
            for (InjurySnapshotDocument doc : docs) {
                reports.put(doc.getTeam(), doc.toReport());
                if (oldest == null || doc.getFetchedAt().isBefore(oldest)) {
                    oldest = doc.getFetchedAt();
                }
            }
            log.debug("Loaded {} persisted injury snapshots", reports.size());
            return Optional.of(new Snapshot(reports, oldest));
        } catch (Exception e) {
            log.warn("Could not read persisted injury snapshots: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void persist(Map<String, InjuryReport> reports) {
        try {
            repository.deleteAll();
            repository.saveAll(reports.values().stream().map(InjurySnapshotDocument::from).toList());
        } catch (Exception e) {
            log.warn("Could not persist injury snapshot: {}", e.getMessage());
        }
    }

    /**
     * The payload lists one entry per club ({@code injuries[]}), each with a display name and
     * its own {@code injuries[]} of athletes. Clubs that cannot be matched to a known team
     * are skipped.
     */
    static Map<String, InjuryReport> parse(JsonNode root, Instant fetchedAt) {
        JsonNode clubs = root == null ? null : root.get("injuries");
        if (clubs == null || !clubs.isArray()) {
            throw new MalformedPayloadException("expected array field 'injuries'");
        }

        Map<String, InjuryReport> reports = new HashMap<>();
        for (JsonNode club : clubs) {
            Optional<NhlTeam> team = NhlTeam.fromDisplayName(getTextOrNull(club, "displayName"));
            if (team.isEmpty()) {
                log.debug("Skipping unknown injury club '{}'", getTextOrNull(club, "displayName"));
                continue;
            }

            List<String> players = new ArrayList<>();
            for (JsonNode injury : club.path("injuries")) {
                String name = getTextOrNull(injury.path("athlete"), "displayName");
                if (name != null && !name.isBlank()) {
                    players.add(name.trim());
                }
            }
            if (!players.isEmpty()) {
                reports.put(team.get().name(), new InjuryReport(team.get().name(), players, fetchedAt));
            }
        }
        return reports;
    }

    private static String getTextOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return (value != null && !value.isNull()) ? value.asText() : null;
    }

    private record Snapshot(Map<String, InjuryReport> reports, Instant fetchedAt) {
    }
}
