package org.carball.showplan.analyzer;

import org.carball.showplan.model.plan.MissingIndex;

/**
 * A missing index suggestion together with the statement it came from. Indexes are zero based.
 */
public record MissingIndexEntry(int batchIndex, int statementIndex, String statementText, MissingIndex index) {}
