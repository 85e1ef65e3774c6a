package org.carball.showplan.parser;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.model.plan.PlanNode;

import java.util.HashSet;
import java.util.Set;

/**
 * Mutable state of a single parse call. Never shared between calls, which keeps the parser itself stateless.
 */
@Slf4j
@Getter
class ParseContext {

    private int skippedStatementCount;
    private int statementCount;
    private int operatorCount;
    private final Set<Integer> statementNodeIds = new HashSet<>();

    void beginStatement() {
        statementNodeIds.clear();
    }

    void statementParsed() {
        statementCount++;
    }

    void statementSkipped(String statementType, String statementText) {
        skippedStatementCount++;
        log.debug("Skipping {} statement without a root operator: {}",
                statementType.isEmpty() ? "untyped" : statementType, preview(statementText));
    }

    void operatorParsed(PlanNode node) {
        operatorCount++;
        if (!statementNodeIds.add(node.getNodeId())) {
            log.debug("Duplicate NodeId {} ({}) within one statement", node.getNodeId(), node.getPhysicalOp());
        }
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
