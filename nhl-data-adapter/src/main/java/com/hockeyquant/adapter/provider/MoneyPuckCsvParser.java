package com.hockeyquant.adapter.provider;

import com.hockeyquant.adapter.model.GoalieProfile;
import com.hockeyquant.adapter.model.Situation;
import com.hockeyquant.adapter.model.SkaterSeasonLine;
import com.hockeyquant.adapter.model.TeamStatLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses MoneyPuck season-summary CSVs into value types.
 *
 * <p>Rows that fail to parse are logged and skipped. A missing required column fails
 * the whole table with {@link MalformedCsvException}.
 */
@Component
public class MoneyPuckCsvParser {

    private static final Logger log = LoggerFactory.getLogger(MoneyPuckCsvParser.class);

    private static final List<String> TEAM_COLUMNS = List.of(
            "team", "situation", "games_played", "xGoalsFor", "xGoalsAgainst",
            "goalsFor", "goalsAgainst", "penaltiesFor", "penaltiesAgainst");

    private static final List<String> GOALIE_COLUMNS = List.of(
            "name", "team", "situation", "games_played", "icetime", "xGoals", "goals", "ongoal");

    private static final List<String> SKATER_COLUMNS = List.of(
            "name", "team", "situation", "icetime", "I_F_goals", "I_F_primaryAssists", "I_F_secondaryAssists");

    /**
     * Team rows for the all-situations, 5-on-4 and 4-on-5 splits. Other splits are dropped.
     */
    public List<TeamStatLine> parseTeams(String csv) {
        return parse(csv, "teams", TEAM_COLUMNS, row -> {
            Optional<Situation> situation = Situation.fromCode(row.text("situation"));
            if (situation.isEmpty()) {
                return null;
            }
            return new TeamStatLine(
                    row.text("team"),
                    situation.get(),
                    (int) row.number("games_played"),
                    row.number("xGoalsFor"),
                    row.number("xGoalsAgainst"),
                    row.number("goalsFor"),
                    row.number("goalsAgainst"),
                    row.number("penaltiesFor"),
                    row.number("penaltiesAgainst"));
        });
    }

    public List<GoalieProfile> parseGoalies(String csv) {
        return parse(csv, "goalies", GOALIE_COLUMNS, row -> {
            if (!Situation.ALL.getCode().equals(row.text("situation"))) {
                return null;
            }
            return GoalieProfile.fromCounts(
                    row.text("name"),
                    row.text("team"),
                    (int) row.number("games_played"),
                    row.number("xGoals"),
                    row.number("goals"),
                    row.number("ongoal"),
                    row.number("icetime"));
        });
    }

    public List<SkaterSeasonLine> parseSkaters(String csv) {
        return parse(csv, "skaters", SKATER_COLUMNS, row -> {
            if (!Situation.ALL.getCode().equals(row.text("situation"))) {
                return null;
            }
            double points = row.number("I_F_goals")
                    + row.number("I_F_primaryAssists")
                    + row.number("I_F_secondaryAssists");
            // Older exports carry xGoalsFor, current ones only the on-ice column
            double xgf = row.has("xGoalsFor") ? row.number("xGoalsFor") : row.numberOrZero("OnIce_F_xGoals");
            return new SkaterSeasonLine(row.text("name"), row.text("team"), points, row.number("icetime"), xgf);
        });
    }

    private <T> List<T> parse(String csv, String table, List<String> required, Function<Row, T> mapper) {
        List<T> out = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new StringReader(csv))) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new MalformedCsvException(table + ".csv is empty");
            }

            String[] headers = parseCSVLine(headerLine);
            Map<String, Integer> columnIndex = new HashMap<>();
            for (int i = 0; i < headers.length; i++) {
                // teams.csv repeats the "team" column; the first one is the abbreviation
                columnIndex.putIfAbsent(headers[i].trim(), i);
            }
            for (String column : required) {
                if (!columnIndex.containsKey(column)) {
                    throw new MalformedCsvException(table + ".csv is missing column '" + column + "'");
                }
            }

            String line;
            int lineNum = 1;
            int skipped = 0;
            while ((line = reader.readLine()) != null) {
                lineNum++;
                if (line.trim().isEmpty()) continue;

                try {
                    T value = mapper.apply(new Row(parseCSVLine(line), columnIndex));
                    if (value != null) {
                        out.add(value);
                    }
                } catch (RuntimeException e) {
                    skipped++;
                    log.warn("Failed to parse {}.csv line {}: {}", table, lineNum, e.getMessage());
                }
            }
            log.debug("Parsed {} rows from {}.csv ({} skipped)", out.size(), table, skipped);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out;
    }

    static String[] parseCSVLine(String line) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                values.add(current.toString());
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        values.add(current.toString());

        return values.toArray(new String[0]);
    }

    private static final class Row {
        private final String[] values;
        private final Map<String, Integer> columnIndex;

        private Row(String[] values, Map<String, Integer> columnIndex) {
            this.values = values;
            this.columnIndex = columnIndex;
        }

        boolean has(String column) {
            return columnIndex.containsKey(column);
        }

        String text(String column) {
            Integer idx = columnIndex.get(column);
            if (idx == null || idx >= values.length) {
                throw new IllegalArgumentException("no value for " + column);
            }
            return values[idx].trim();
        }

        double number(String column) {
            String raw = text(column);
            if (raw.isEmpty()) {
                throw new IllegalArgumentException("blank " + column);
            }
            return Double.parseDouble(raw);
        }

        double numberOrZero(String column) {
            if (!has(column)) {
                return 0.0;
            }
            String raw = text(column);
            return raw.isEmpty() ? 0.0 : Double.parseDouble(raw);
        }
    }

    /**
     * The CSV does not have the shape this parser expects.
     */
    public static class MalformedCsvException extends RuntimeException {
        public MalformedCsvException(String message) {
            super(message);
        }
    }
}
