package com.spiderhub.common.util;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;

public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Lower-cased host of an absolute URL, or an empty string if it has none.
     */
    public static String host(String url) {
        if (url == null) return "";
        try {
            String h = URI.create(url.trim()).getHost();
            return h == null ? "" : h.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    public static String scheme(String url) {
        if (url == null) return "";
        int idx = url.indexOf("://");
        return idx > 0 ? url.substring(0, idx).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * {@code scheme://host[:port]/}, used for Referer/Origin defaults.
     */
    public static String origin(String url) {
        try {
            URI uri = URI.create(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) return "";
            String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
            return uri.getScheme() + "://" + uri.getHost() + port;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /**
     * Lower-cased path of a URL without query or fragment.
     */
    public static String path(String url) {
        if (url == null) return "";
        String u = url;
        int cut = indexOfAny(u, '?', '#');
        if (cut >= 0) u = u.substring(0, cut);
        int schemeIdx = u.indexOf("://");
        if (schemeIdx >= 0) {
            int slash = u.indexOf('/', schemeIdx + 3);
            u = slash >= 0 ? u.substring(slash) : "/";
        }
        return u.toLowerCase(Locale.ROOT);
    }

    /**
     * Extension of the last path segment ("m3u8", "mp4"...), or empty.
     */
    public static String extension(String url) {
        String p = path(url);
        int slash = p.lastIndexOf('/');
        String last = slash >= 0 ? p.substring(slash + 1) : p;
        int dot = last.lastIndexOf('.');
        return dot >= 0 && dot < last.length() - 1 ? last.substring(dot + 1) : "";
    }

    /**
     * Removes query parameters whose name is in {@code names} or starts with one of {@code prefixes}.
     * Order of the remaining parameters and the fragment are kept.
     */
    public static String removeQueryParams(String url, Set<String> names, Set<String> prefixes) {
        if (url == null) return null;
        int q = url.indexOf('?');
        if (q < 0) return url;

        String base = url.substring(0, q);
        String rest = url.substring(q + 1);
        String fragment = "";
        int hash = rest.indexOf('#');
        if (hash >= 0) {
            fragment = rest.substring(hash);
            rest = rest.substring(0, hash);
        }

        StringJoiner kept = new StringJoiner("&");
        for (String part : rest.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            String name = (eq >= 0 ? part.substring(0, eq) : part).toLowerCase(Locale.ROOT);
            if (names.contains(name)) continue;
            if (prefixes.stream().anyMatch(name::startsWith)) continue;
            kept.add(part);
        }
        String query = kept.toString();
        return base + (query.isEmpty() ? "" : "?" + query) + fragment;
    }

    public static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    /**
     * Resolves {@code href} against {@code base}; returns {@code href} unchanged if it is already absolute.
     */
    public static String resolve(String base, String href) {
        if (href == null || href.isEmpty()) return href;
        if (href.startsWith("http://") || href.startsWith("https://")) return href;
        try {
            if (href.startsWith("//")) return scheme(base) + ":" + href;
            return URI.create(base).resolve(href).toString();
        } catch (IllegalArgumentException e) {
            return href;
        }
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }
}
