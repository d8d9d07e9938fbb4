package org.janelia.speckle.correction;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Number of pixels affected by each step of the repair of a corrected contrast map.
 */
public class RepairSummary {

    private final long nanReplaced;
    private final long infiniteReplaced;
    private final long inpainted;
    private final long keptRaw;

    public RepairSummary(long nanReplaced, long infiniteReplaced, long inpainted, long keptRaw) {
        this.nanReplaced = nanReplaced;
        this.infiniteReplaced = infiniteReplaced;
        this.inpainted = inpainted;
        this.keptRaw = keptRaw;
    }

    /**
     * @return pixels whose corrected value was NaN and was replaced by the raw contrast
     */
    public long getNanReplaced() {
        return nanReplaced;
    }

    /**
     * @return pixels whose corrected value was infinite and was replaced by the raw contrast
     */
    public long getInfiniteReplaced() {
        return infiniteReplaced;
    }

    /**
     * @return pixels filled from their neighbors because their value was below the floor or still not finite
     */
    public long getInpainted() {
        return inpainted;
    }

    /**
     * @return unsaturated pixels for which the raw contrast was kept
     */
    public long getKeptRaw() {
        return keptRaw;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("nanReplaced", nanReplaced)
                .append("infiniteReplaced", infiniteReplaced)
                .append("inpainted", inpainted)
                .append("keptRaw", keptRaw)
                .toString();
    }
}
