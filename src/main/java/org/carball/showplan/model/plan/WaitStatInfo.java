package org.carball.showplan.model.plan;

public record WaitStatInfo(String waitType, long waitTimeMs, long waitCount) {}
