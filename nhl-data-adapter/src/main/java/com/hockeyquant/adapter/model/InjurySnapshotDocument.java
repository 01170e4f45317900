package com.hockeyquant.adapter.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted injury list for one club, so a restart inside the freshness window
 * does not need to hit the feed again.
 */
@Document(collection = "injury_snapshots")
public class InjurySnapshotDocument {

    @Id
    private String team;

    private List<String> players = new ArrayList<>();

    @Indexed
    private Instant fetchedAt;

    public InjurySnapshotDocument() {
    }

    public static InjurySnapshotDocument from(InjuryReport report) {
        InjurySnapshotDocument doc = new InjurySnapshotDocument();
        doc.setTeam(report.team());
        doc.setPlayers(new ArrayList<>(report.players()));
        doc.setFetchedAt(report.fetchedAt());
        return doc;
    }

    public InjuryReport toReport() {
        return new InjuryReport(team, players, fetchedAt);
    }

    public String getTeam() {
        return team;
    }

    public void setTeam(String team) {
        this.team = team;
    }

    public List<String> getPlayers() {
        return players;
    }

    public void setPlayers(List<String> players) {
        this.players = players;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public void setFetchedAt(Instant fetchedAt) {
        this.fetchedAt = fetchedAt;
    }
}
