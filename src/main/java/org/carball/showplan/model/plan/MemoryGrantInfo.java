package org.carball.showplan.model.plan;

import lombok.Builder;
import lombok.Data;

/**
 * Statement level memory grant figures, all in KB except the wait time.
 */
@Data
@Builder
public class MemoryGrantInfo {
    private long serialRequiredMemoryKB;
    private long serialDesiredMemoryKB;
    private long requiredMemoryKB;
    private long desiredMemoryKB;
    private long requestedMemoryKB;
    private long grantedMemoryKB;
    private long maxUsedMemoryKB;
    private long grantWaitTimeMs;
    private long lastRequestedMemoryKB;
    private String memoryGrantFeedbackAdjusted;
}
