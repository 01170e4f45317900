package com.hockeyquant.prediction.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "hockeyquant.engine")
public class EngineProperties {

    // Worker threads for analyzing games of one slate; 1 runs games in order on the caller
    private int parallelism = 4;

    private boolean runnerEnabled = false;

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public boolean isRunnerEnabled() {
        return runnerEnabled;
    }

    public void setRunnerEnabled(boolean runnerEnabled) {
        this.runnerEnabled = runnerEnabled;
    }
}
