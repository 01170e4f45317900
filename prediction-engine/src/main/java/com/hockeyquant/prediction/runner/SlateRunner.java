package com.hockeyquant.prediction.runner;

import com.hockeyquant.prediction.model.GamePrediction;
import com.hockeyquant.prediction.service.SlateOrchestrator;
import com.hockeyquant.prediction.service.SlateUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Analyzes one slate at startup and logs the picks. Takes {@code --date=YYYY-MM-DD},
 * defaulting to today.
 */
@Component
@ConditionalOnProperty(prefix = "hockeyquant.engine", name = "runner-enabled", havingValue = "true")
public class SlateRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SlateRunner.class);

    private final SlateOrchestrator orchestrator;
    private final Clock clock;

    public SlateRunner(SlateOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        LocalDate date = resolveDate(args);
        try {
            List<GamePrediction> predictions = orchestrator.analyze(date);
            if (predictions.isEmpty()) {
                log.info("No predictions for {}", date);
                return;
            }
            for (GamePrediction p : predictions) {
                log.info("{} @ {} -> {} by {} [{}] {}",
                        p.away().team(), p.home().team(), p.pick(),
                        String.format("%.2f", p.scoreDiff()), p.tier(), p.keyFactors());
            }
        } catch (SlateUnavailableException e) {
            log.error("Cannot analyze {}: {}", date, e.getMessage());
        }
    }

    LocalDate resolveDate(ApplicationArguments args) {
        List<String> values = args.getOptionValues("date");
        if (values == null || values.isEmpty()) {
            return LocalDate.now(clock);
        }
        return LocalDate.parse(values.get(0));
    }
}
