package com.hockeyquant.prediction.service;

import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.FinalScore;
import com.hockeyquant.adapter.provider.ScheduleProvider;
import com.hockeyquant.prediction.model.AccuracyReport;
import com.hockeyquant.prediction.model.ConfidenceTier;
import com.hockeyquant.prediction.model.GamePrediction;
import com.hockeyquant.prediction.model.TierAccuracy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Grades picks against final scores, overall and per confidence tier.
 */
@Service
public class AccuracyService {

    private static final Logger log = LoggerFactory.getLogger(AccuracyService.class);

    private final ScheduleProvider scheduleProvider;

    public AccuracyService(ScheduleProvider scheduleProvider) {
        this.scheduleProvider = scheduleProvider;
    }

    /**
     * Fetch the date's final scores and grade the predictions made for it.
     */
    public AccuracyReport grade(LocalDate date, List<GamePrediction> predictions) {
        FetchResult<List<FinalScore>> results = scheduleProvider.fetchResults(date);
        if (!results.isSuccess()) {
            log.warn("Results unavailable for {}, all {} predictions ungraded: {}",
                    date, predictions.size(), results.getError());
        }
        return grade(predictions, results.orElse(List.of()));
    }

    public AccuracyReport grade(List<GamePrediction> predictions, List<FinalScore> results) {
        Map<String, FinalScore> byMatchup = new HashMap<>();
        for (FinalScore score : results) {
            byMatchup.put(matchupKey(score.away(), score.home()), score);
        }

        int total = 0;
        int correct = 0;
        int ungraded = 0;
        Map<ConfidenceTier, int[]> tierCounts = new EnumMap<>(ConfidenceTier.class);
        for (ConfidenceTier tier : ConfidenceTier.values()) {
            tierCounts.put(tier, new int[2]);
        }

        for (GamePrediction prediction : predictions) {
            FinalScore score = byMatchup.get(matchupKey(prediction.away().team(), prediction.home().team()));
            if (score == null || score.winner() == null) {
                ungraded++;
                continue;
            }
            boolean hit = prediction.pick().equals(score.winner());
            total++;
            int[] counts = tierCounts.get(prediction.tier());
            counts[0]++;
            if (hit) {
                correct++;
                counts[1]++;
            }
        }

        Map<ConfidenceTier, TierAccuracy> byTier = new EnumMap<>(ConfidenceTier.class);
        tierCounts.forEach((tier, counts) -> byTier.put(tier, TierAccuracy.of(tier, counts[0], counts[1])));

        double accuracy = total == 0 ? 0.0 : (double) correct / total;
        log.info("Graded {} predictions: {}/{} correct, {} ungraded", predictions.size(), correct, total, ungraded);
        return new AccuracyReport(total, correct, ungraded, accuracy, byTier);
    }

    private static String matchupKey(String away, String home) {
        return away + "@" + home;
    }
}
