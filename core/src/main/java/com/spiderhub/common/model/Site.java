package com.spiderhub.common.model;

import com.spiderhub.common.error.ConfigException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A configured content source. Immutable once built; produced by the external
 * site configuration loader.
 */
public final class Site {
    private final String key;
    private final String name;
    private final SiteKind kind;
    private final String api;
    private final String ext;
    private final String jar;
    private final Map<String, String> headers;
    private final boolean searchable;
    private final boolean filterable;
    private final boolean quickSearchable;
    private final long timeoutMs;

    private Site(Builder b) {
        this.key = b.key;
        this.name = b.name == null ? b.key : b.name;
        this.kind = b.kind;
        this.api = b.api;
        this.ext = b.ext == null ? "" : b.ext;
        this.jar = b.jar == null ? "" : b.jar;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.searchable = b.searchable;
        this.filterable = b.filterable;
        this.quickSearchable = b.quickSearchable;
        this.timeoutMs = b.timeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public SiteKind getKind() { return kind; }
    public String getApi() { return api; }
    public String getExt() { return ext; }
    public String getJar() { return jar; }
    public Map<String, String> getHeaders() { return headers; }
    public boolean isSearchable() { return searchable; }
    public boolean isFilterable() { return filterable; }
    public boolean isQuickSearchable() { return quickSearchable; }
    public long getTimeoutMs() { return timeoutMs; }

    /**
     * Checks the fields every backend relies on.
     *
     * @throws ConfigException if the key or api is missing, or the kind is unknown
     */
    public void validate() throws ConfigException {
        if (key == null || key.isBlank()) {
            throw new ConfigException("Site without key (api=" + api + ")");
        }
        if (api == null || api.isBlank()) {
            throw new ConfigException("Site " + key + " has no api");
        }
        if (kind == null) {
            throw new ConfigException("Site " + key + " has an unknown parser kind");
        }
        if (timeoutMs < 0) {
            throw new ConfigException("Site " + key + " has a negative timeout");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Site other)) return false;
        return Objects.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(key);
    }

    @Override
    public String toString() {
        return "Site{" + key + ", " + kind + ", " + api + "}";
    }

    public static final class Builder {
        private String key;
        private String name;
        private SiteKind kind;
        private String api;
        private String ext;
        private String jar;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private boolean searchable = true;
        private boolean filterable = true;
        private boolean quickSearchable = true;
        private long timeoutMs = 0;

        private Builder() {
        }

        public Builder key(String key) { this.key = key; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder kind(SiteKind kind) { this.kind = kind; return this; }
        public Builder api(String api) { this.api = api; return this; }
        public Builder ext(String ext) { this.ext = ext; return this; }
        public Builder jar(String jar) { this.jar = jar; return this; }
        public Builder header(String name, String value) { this.headers.put(name, value); return this; }
        public Builder headers(Map<String, String> headers) { if (headers != null) this.headers.putAll(headers); return this; }
        public Builder searchable(boolean searchable) { this.searchable = searchable; return this; }
        public Builder filterable(boolean filterable) { this.filterable = filterable; return this; }
        public Builder quickSearchable(boolean quickSearchable) { this.quickSearchable = quickSearchable; return this; }
        public Builder timeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; return this; }

        /**
         * Derives the kind from a numeric source type, the way source configs declare it.
         */
        public Builder type(int type) {
            this.kind = SiteKind.resolve(type, api);
            return this;
        }

        public Site build() {
            return new Site(this);
        }
    }
}
