package org.carball.showplan.model.plan;

import lombok.Data;

/**
 * Statement-level memory grant figures, all in KB except the wait time.
 */
@Data
public class MemoryGrantInfo {
    private long serialRequiredMemoryKb;
    private long serialDesiredMemoryKb;
    private long requiredMemoryKb;
    private long desiredMemoryKb;
    private long requestedMemoryKb;
    private long grantedMemoryKb;
    private long maxUsedMemoryKb;
    private long grantWaitTimeMs;
    private long lastRequestedMemoryKb;
    private String feedbackAdjusted;

    public double getGrantToUsedRatio() {
        return maxUsedMemoryKb > 0 ? (double) grantedMemoryKb / maxUsedMemoryKb : 0;
    }
}
