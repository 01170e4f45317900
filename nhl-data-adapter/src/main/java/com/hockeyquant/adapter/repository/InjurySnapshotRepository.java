package com.hockeyquant.adapter.repository;

import com.hockeyquant.adapter.model.InjurySnapshotDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface InjurySnapshotRepository extends MongoRepository<InjurySnapshotDocument, String> {

    /**
     * Snapshots written after the given instant, i.e. still inside the freshness window
     */
    List<InjurySnapshotDocument> findByFetchedAtAfter(Instant since);
}
