package com.fleetdeck.core.directory;

import com.fleetdeck.core.model.NodeRecord;

import java.util.List;

/**
 * Supplies the raw fleet membership. Output may contain duplicates and is
 * not expected to be ordered.
 */
public interface DiscoverySource {

    /**
     * @throws DiscoveryException if the membership cannot be read
     */
    List<NodeRecord> discover();
}
