package com.hockeyquant.adapter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "hockeyquant.sources")
public class DataSourceProperties {

    private String nhlBaseUrl = "https://api-web.nhle.com/v1";
    private String moneyPuckBaseUrl = "https://moneypuck.com/moneypuck/playerData/seasonSummary";
    private String espnBaseUrl = "https://site.api.espn.com/apis/site/v2/sports/hockey/nhl";

    // Pin the MoneyPuck season start year; null follows the calendar
    private Integer moneyPuckSeason;

    private int connectTimeoutMillis = 10000;
    private Duration responseTimeout = Duration.ofSeconds(15);
    private Duration statsTtl = Duration.ofHours(1);
    private Duration injuryTtl = Duration.ofHours(2);

    public String getNhlBaseUrl() {
        return nhlBaseUrl;
    }

    public void setNhlBaseUrl(String nhlBaseUrl) {
        this.nhlBaseUrl = nhlBaseUrl;
    }

    public String getMoneyPuckBaseUrl() {
        return moneyPuckBaseUrl;
    }

    public void setMoneyPuckBaseUrl(String moneyPuckBaseUrl) {
        this.moneyPuckBaseUrl = moneyPuckBaseUrl;
    }

    public String getEspnBaseUrl() {
        return espnBaseUrl;
    }

    public void setEspnBaseUrl(String espnBaseUrl) {
        this.espnBaseUrl = espnBaseUrl;
    }

    public Integer getMoneyPuckSeason() {
        return moneyPuckSeason;
    }

    public void setMoneyPuckSeason(Integer moneyPuckSeason) {
        this.moneyPuckSeason = moneyPuckSeason;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public Duration getResponseTimeout() {
        return responseTimeout;
    }

    public void setResponseTimeout(Duration responseTimeout) {
        this.responseTimeout = responseTimeout;
    }

    public Duration getStatsTtl() {
        return statsTtl;
    }

    public void setStatsTtl(Duration statsTtl) {
        this.statsTtl = statsTtl;
    }

    public Duration getInjuryTtl() {
        return injuryTtl;
    }

    public void setInjuryTtl(Duration injuryTtl) {
        this.injuryTtl = injuryTtl;
    }
}
