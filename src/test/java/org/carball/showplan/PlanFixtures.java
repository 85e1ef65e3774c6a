package org.carball.showplan;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads showplan documents from src/test/resources/plans.
 */
public final class PlanFixtures {

    public static final String SIMPLE_SCAN = "simple-scan.sqlplan";
    public static final String HASH_JOIN = "hash-join.sqlplan";
    public static final String ACTUAL_SORT_SPILL = "actual-sort-spill.sqlplan";
    public static final String MISSING_INDEXES = "missing-indexes.sqlplan";
    public static final String MULTI_STATEMENT = "multi-statement.sqlplan";

    private PlanFixtures() {
    }

    public static String load(String name) {
        try (InputStream in = PlanFixtures.class.getResourceAsStream("/plans/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No plan fixture named " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
