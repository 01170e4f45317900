package com.hockeyquant.adapter.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The 32 NHL clubs with the static facts the engine needs: division for
 * head-to-head depth, and home-city UTC offset for travel fatigue.
 */
public enum NhlTeam {
    ANA("Anaheim Ducks", Division.PACIFIC, -8),
    BOS("Boston Bruins", Division.ATLANTIC, -5),
    BUF("Buffalo Sabres", Division.ATLANTIC, -5),
    CGY("Calgary Flames", Division.PACIFIC, -7),
    CAR("Carolina Hurricanes", Division.METROPOLITAN, -5),
    CHI("Chicago Blackhawks", Division.CENTRAL, -6),
    COL("Colorado Avalanche", Division.CENTRAL, -7),
    CBJ("Columbus Blue Jackets", Division.METROPOLITAN, -5),
    DAL("Dallas Stars", Division.CENTRAL, -6),
    DET("Detroit Red Wings", Division.ATLANTIC, -5),
    EDM("Edmonton Oilers", Division.PACIFIC, -7),
    FLA("Florida Panthers", Division.ATLANTIC, -5),
    LAK("Los Angeles Kings", Division.PACIFIC, -8),
    MIN("Minnesota Wild", Division.CENTRAL, -6),
    MTL("Montreal Canadiens", Division.ATLANTIC, -5),
    NSH("Nashville Predators", Division.CENTRAL, -6),
    NJD("New Jersey Devils", Division.METROPOLITAN, -5),
    NYI("New York Islanders", Division.METROPOLITAN, -5),
    NYR("New York Rangers", Division.METROPOLITAN, -5),
    OTT("Ottawa Senators", Division.ATLANTIC, -5),
    PHI("Philadelphia Flyers", Division.METROPOLITAN, -5),
    PIT("Pittsburgh Penguins", Division.METROPOLITAN, -5),
    SJS("San Jose Sharks", Division.PACIFIC, -8),
    SEA("Seattle Kraken", Division.PACIFIC, -8),
    STL("St. Louis Blues", Division.CENTRAL, -6),
    TBL("Tampa Bay Lightning", Division.ATLANTIC, -5),
    TOR("Toronto Maple Leafs", Division.ATLANTIC, -5),
    UTA("Utah Hockey Club", Division.CENTRAL, -7),
    VAN("Vancouver Canucks", Division.PACIFIC, -8),
    VGK("Vegas Golden Knights", Division.PACIFIC, -8),
    WSH("Washington Capitals", Division.METROPOLITAN, -5),
    WPG("Winnipeg Jets", Division.CENTRAL, -6);

    /** Offset assumed for any abbreviation outside the directory */
    public static final int DEFAULT_UTC_OFFSET = -5;

    private final String fullName;
    private final Division division;
    private final int utcOffset;

    NhlTeam(String fullName, Division division, int utcOffset) {
        this.fullName = fullName;
        this.division = division;
        this.utcOffset = utcOffset;
    }

    public String getFullName() {
        return fullName;
    }

    public Division getDivision() {
        return division;
    }

    public Conference getConference() {
        return division.getConference();
    }

    public int getUtcOffset() {
        return utcOffset;
    }

    public static Optional<NhlTeam> fromAbbrev(String abbrev) {
        if (abbrev == null || abbrev.isBlank()) {
            return Optional.empty();
        }
        String upper = abbrev.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.name().equals(upper))
                .findFirst();
    }

    /**
     * Match a display name such as "Toronto Maple Leafs" or "Injuries: Toronto Maple Leafs".
     */
    public static Optional<NhlTeam> fromDisplayName(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return Optional.empty();
        }
        String lower = displayName.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> lower.contains(t.fullName.toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    public static int utcOffsetOf(String abbrev) {
        return fromAbbrev(abbrev).map(NhlTeam::getUtcOffset).orElse(DEFAULT_UTC_OFFSET);
    }
}
