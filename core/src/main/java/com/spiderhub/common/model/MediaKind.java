package com.spiderhub.common.model;

/**
 * How a resolved play URL should be handled by the player.
 */
public enum MediaKind {
    /** Playable media stream (file extension or playlist recognized). */
    DIRECT,
    /** Page or parser endpoint that still needs a sniffing/parsing pass. */
    NEEDS_PARSE,
    UNKNOWN
}
