package com.spiderhub.core.engine;

import com.spiderhub.api.Invoker;
import com.spiderhub.common.error.BackendInitException;
import com.spiderhub.common.model.Site;
import com.spiderhub.core.net.SiteHttpClient;

/**
 * Brings up an {@link Invoker} for a site. Initialization may block on network I/O
 * (script or jar download) and runs once per site.
 */
public interface Backend {

    BackendType type();

    Invoker initialize(Site site, SiteHttpClient http) throws BackendInitException;
}
