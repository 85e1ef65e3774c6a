package org.carball.showplan.model.plan;

public record SetOptionsInfo(
        boolean ansiNulls,
        boolean ansiPadding,
        boolean ansiWarnings,
        boolean arithAbort,
        boolean concatNullYieldsNull,
        boolean numericRoundAbort,
        boolean quotedIdentifier
) {}
