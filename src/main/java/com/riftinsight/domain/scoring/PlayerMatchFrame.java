package com.riftinsight.domain.scoring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular view of a player's recent matches: one row per match, newest first,
 * columns are derived per-match features.
 *
 * Numeric cells are Numbers; championName/teamPosition are Strings.
 */
public final class PlayerMatchFrame {

    public static final String WIN = "win";
    public static final String GAME_CREATION = "gameCreation";

    private final List<Map<String, Object>> rows;

    public PlayerMatchFrame(List<Map<String, Object>> rows) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static PlayerMatchFrame empty() {
        return new PlayerMatchFrame(List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    /**
     * Copy of the newest row, or an empty map.
     */
    public Map<String, Object> latest() {
        return rows.isEmpty() ? new LinkedHashMap<>() : new LinkedHashMap<>(rows.get(0));
    }

    public boolean hasColumn(String column) {
        return rows.stream().anyMatch(row -> row.containsKey(column));
    }

    /**
     * Finite numeric values of a column, newest first. Rows without a numeric
     * value are skipped.
     */
    public List<Double> column(String column) {
        List<Double> values = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value instanceof Number && Double.isFinite(((Number) value).doubleValue())) {
                values.add(((Number) value).doubleValue());
            }
        }
        return values;
    }

    public double mean(String column) {
        List<Double> values = column(column);
        if (values.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Win rate in percent; 50.0 for an empty frame.
     */
    public double winRate() {
        return isEmpty() ? 50.0 : mean(WIN) * 100.0;
    }

    /**
     * Rows restricted to the given columns, skipping columns no row has.
     */
    public List<Map<String, Object>> select(List<String> columns) {
        List<String> present = new ArrayList<>();
        for (String column : columns) {
            if (hasColumn(column)) {
                present.add(column);
            }
        }
        List<Map<String, Object>> selected = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String column : present) {
                projected.put(column, row.get(column));
            }
            selected.add(projected);
        }
        return selected;
    }
}
