package org.mimir.team;

import org.mimir.artifact.ArtifactReference;

import java.time.LocalTime;
import java.util.List;

/**
 * @param time       when to warm, a lead time before {@code hourOfDay}
 * @param hourOfDay  the busy hour this slot prepares for
 * @param volume     events seen in that hour over the analysis window
 */
public record WarmSlot(LocalTime time, int hourOfDay, long volume, List<ArtifactReference> references) {

    public WarmSlot {
        references = List.copyOf(references);
    }
}
