package com.spiderhub.plugins.m3u.internal;

public record M3uChannel(String id, String name, String group, String url, String tvgId, String logo) {
}
