package com.spiderhub.common.model;

/**
 * Outcome of one site inside an aggregate query.
 */
public record SiteResult(Site site, ContentEnvelope envelope, long durationMs) {

    public boolean isOk() {
        return envelope.isOk();
    }

    public EnvelopeStatus status() {
        return envelope.getStatus();
    }
}
