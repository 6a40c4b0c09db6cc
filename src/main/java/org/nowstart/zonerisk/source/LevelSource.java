package org.nowstart.zonerisk.source;

import java.util.List;
import org.nowstart.zonerisk.zone.core.LevelBatch;

/**
 * Produces candidate support/resistance prices for one evaluation cycle.
 *
 * <p>Implementations may block on I/O. They are always called off the zone state writer thread and
 * under a timeout, so they should not catch and hide failures: a thrown exception simply means the
 * source contributes nothing this cycle.
 */
public interface LevelSource {

    String tag();

    List<LevelBatch> collect(LevelSourceContext context);
}
