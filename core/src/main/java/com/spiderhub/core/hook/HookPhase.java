package com.spiderhub.core.hook;

public enum HookPhase {
    REQUEST,
    RESPONSE,
    PLAYER
}
