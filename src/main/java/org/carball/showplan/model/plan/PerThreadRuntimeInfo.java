package org.carball.showplan.model.plan;

import lombok.Builder;
import lombok.Data;

/**
 * Runtime counters of one worker thread for one operator (actual plans only).
 */
@Data
@Builder
public class PerThreadRuntimeInfo {
    private int threadId;
    private long actualRows;
    private long actualExecutions;
    private long actualElapsedMs;
    private long actualCpuMs;
    private long actualRowsRead;
    private long actualLogicalReads;
    private long actualPhysicalReads;
    private long actualScans;
    private long actualReadAheads;
    private long firstActiveTime;
    private long lastActiveTime;
    private long openTime;
    private long firstRowTime;
    private long lastRowTime;
    private long closeTime;
    private long inputMemoryGrant;
    private long outputMemoryGrant;
    private long usedMemoryGrant;
    private long batches;
    private long actualEndOfScans;
    private long actualLocallyAggregatedRows;
    private boolean interleavedExecuted;
    private long rowRequalifications;
}
