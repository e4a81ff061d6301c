package com.spiderhub.plugins.m3u.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extended M3U playlist reader: {@code #EXTINF} lines carry name and attributes,
 * the next URL line is the stream.
 */
public class M3uParser {
    public static final String DEFAULT_GROUP = "Other";
    private static final Pattern TRAILING_ID = Pattern.compile("(\\d{4,})(?:\\.(?:mp4|ts|mkv|m3u8))?$", Pattern.CASE_INSENSITIVE);

    public List<M3uChannel> parse(String text) {
        List<M3uChannel> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;

        String name = "", group = "", tvgId = "", logo = "";
        for (String raw : text.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty()) continue;

            if (line.startsWith("#EXTINF:")) {
                int idx = line.lastIndexOf(',');
                name = idx >= 0 && idx + 1 < line.length() ? line.substring(idx + 1).trim() : "";
                tvgId = attribute(line, "tvg-id");
                logo = attribute(line, "tvg-logo");
                group = attribute(line, "group-title");
            } else if (line.startsWith("#EXTGRP:")) {
                group = line.substring("#EXTGRP:".length()).trim();
            } else if (line.startsWith("http://") || line.startsWith("https://") || line.startsWith("rtmp://")) {
                String title = name.isEmpty() ? line : name;
                out.add(new M3uChannel(buildId(tvgId, title, line, out.size()), title,
                        group.isEmpty() ? DEFAULT_GROUP : group, line, tvgId, logo));
                name = group = tvgId = logo = "";
            }
        }
        return out;
    }

    static String attribute(String line, String key) {
        String pat = key + "=\"";
        int i = line.indexOf(pat);
        if (i < 0) return "";
        int j = line.indexOf('"', i + pat.length());
        return j > i ? line.substring(i + pat.length(), j).trim() : "";
    }

    // numeric tvg-id, else trailing digits of the URL, else position plus a hash of name and URL
    private static String buildId(String tvgId, String name, String url, int position) {
        if (tvgId.matches("\\d+")) return tvgId;
        Matcher m = TRAILING_ID.matcher(url);
        if (m.find()) return m.group(1);
        return position + "-" + Integer.toUnsignedString((name + "|" + url).hashCode());
    }
}
