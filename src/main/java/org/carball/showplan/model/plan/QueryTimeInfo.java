package org.carball.showplan.model.plan;

public record QueryTimeInfo(long cpuTimeMs, long elapsedTimeMs, long udfCpuTimeMs, long udfElapsedTimeMs) {}
