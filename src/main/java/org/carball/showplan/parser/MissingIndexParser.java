package org.carball.showplan.parser;

import org.carball.showplan.model.plan.MissingIndex;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.carball.showplan.parser.ShowPlanXml.*;

/**
 * Reads the optimizer's missing index suggestions as stated. Only bracket quoting is removed.
 */
final class MissingIndexParser {

    private MissingIndexParser() {
        // Utility class - prevent instantiation
    }

    static List<MissingIndex> parse(Element queryPlanEl) {
        List<MissingIndex> result = new ArrayList<>();
        Element missingIndexesEl = child(queryPlanEl, "MissingIndexes");
        if (missingIndexesEl == null) {
            return result;
        }

        for (Element group : children(missingIndexesEl, "MissingIndexGroup")) {
            double impact = attrDouble(group, "Impact");
            for (Element indexEl : children(group, "MissingIndex")) {
                result.add(parseIndex(indexEl, impact));
            }
        }
        return result;
    }

    private static MissingIndex parseIndex(Element indexEl, double impact) {
        String database = nonNull(bracketFreeAttr(indexEl, "Database"));
        String schema = nonNull(bracketFreeAttr(indexEl, "Schema"));
        String table = nonNull(bracketFreeAttr(indexEl, "Table"));

        List<String> equality = List.of();
        List<String> inequality = List.of();
        List<String> include = List.of();
        for (Element columnGroup : children(indexEl, "ColumnGroup")) {
            List<String> columns = children(columnGroup, "Column").stream()
                    .map(c -> nonNull(bracketFreeAttr(c, "Name")))
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList());
            switch (attr(columnGroup, "Usage", "")) {
                case "EQUALITY" -> equality = columns;
                case "INEQUALITY" -> inequality = columns;
                case "INCLUDE" -> include = columns;
                default -> {
                    // unknown usage, ignored
                }
            }
        }

        return new MissingIndex(database, schema, table, impact, equality, inequality, include,
                createStatement(schema, table, equality, inequality, include));
    }

    /**
     * CREATE NONCLUSTERED INDEX for the suggestion, named after the table and its first three key columns.
     * Empty when the suggestion has no key columns.
     */
    static String createStatement(String schema, String table, List<String> equality,
                                  List<String> inequality, List<String> include) {
        List<String> keys = new ArrayList<>(equality);
        keys.addAll(inequality);
        if (keys.isEmpty()) {
            return "";
        }

        String name = "IX_" + table + "_" + String.join("_", keys.subList(0, Math.min(3, keys.size())));
        StringBuilder sql = new StringBuilder()
                .append("CREATE NONCLUSTERED INDEX [").append(name).append("]\n")
                .append("ON ").append(schema).append('.').append(table)
                .append(" (").append(String.join(", ", keys)).append(')');
        if (!include.isEmpty()) {
            sql.append("\nINCLUDE (").append(String.join(", ", include)).append(')');
        }
        return sql.toString();
    }

    private static String nonNull(String value) {
        return value != null ? value : "";
    }
}
