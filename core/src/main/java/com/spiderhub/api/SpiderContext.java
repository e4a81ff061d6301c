package com.spiderhub.api;

import com.spiderhub.common.model.Site;
import com.spiderhub.core.net.SiteHttpClient;

/**
 * What a spider gets from the engine on init: its site definition and an HTTP
 * client that runs every request and response through the hook pipeline.
 */
public record SpiderContext(Site site, SiteHttpClient http) {
}
