package com.bazaarvoice.regroup.common.dropwizard.lifecycle;

import io.dropwizard.lifecycle.Managed;

/**
 * Objects which start and stop along with the server that owns them.
 */
public interface LifeCycleRegistry {

    /** Registers an object and returns it, so that construction and registration can share a statement. */
    <T extends Managed> T manage(T managed);
}
