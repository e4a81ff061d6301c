package com.spiderhub.common.model;

import java.util.Map;

/**
 * Result of a play-resolve: the final URL plus everything the player needs to open it.
 */
public record PlayDescriptor(String url, Map<String, String> headers, boolean needsParse, String flag, MediaKind mediaKind) {

    public PlayDescriptor {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        mediaKind = mediaKind == null ? MediaKind.UNKNOWN : mediaKind;
    }
}
