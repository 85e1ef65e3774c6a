package org.carball.showplan.model.plan;

public record TraceFlagInfo(int value, String scope, boolean compileTime) {}
