package com.spiderhub.common.model;

import com.google.gson.JsonObject;
import com.spiderhub.common.error.ErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalized output of one parser call. Successful envelopes are built through
 * {@link #builder()}; failures use the static factories and always carry an {@link ErrorKind}.
 */
public class ContentEnvelope {
    private List<ContentItem> items = new ArrayList<>();
    private List<Category> categories = new ArrayList<>();
    private JsonObject filters;
    private int page;
    private int pageCount;
    private int limit;
    private int total;
    private PlayDescriptor play;
    private EnvelopeStatus status = EnvelopeStatus.OK;
    private ErrorKind errorKind;
    private String message;

    private ContentEnvelope() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ContentEnvelope empty() {
        return new ContentEnvelope();
    }

    public static ContentEnvelope failed(ErrorKind kind, String message) {
        ContentEnvelope e = new ContentEnvelope();
        e.status = EnvelopeStatus.FAILED;
        e.errorKind = kind;
        e.message = message;
        return e;
    }

    public static ContentEnvelope timedOut(String message) {
        ContentEnvelope e = failed(ErrorKind.TIMEOUT, message);
        e.status = EnvelopeStatus.TIMED_OUT;
        return e;
    }

    public static ContentEnvelope cancelled() {
        ContentEnvelope e = failed(ErrorKind.CANCELLED, "cancelled");
        e.status = EnvelopeStatus.CANCELLED;
        return e;
    }

    public List<ContentItem> getItems() { return items == null ? List.of() : Collections.unmodifiableList(items); }
    public List<Category> getCategories() { return categories == null ? List.of() : Collections.unmodifiableList(categories); }
    public JsonObject getFilters() { return filters; }
    public int getPage() { return page; }
    public int getPageCount() { return pageCount; }
    public int getLimit() { return limit; }
    public int getTotal() { return total; }
    public PlayDescriptor getPlay() { return play; }
    public EnvelopeStatus getStatus() { return status; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }

    public boolean isOk() {
        return status == EnvelopeStatus.OK;
    }

    /**
     * Only successful envelopes may be stored in the result cache.
     */
    public boolean isCacheable() {
        return isOk();
    }

    public boolean hasMorePages() {
        return isOk() && pageCount > 0 && page < pageCount;
    }

    /**
     * Copy limited to the first {@code max} items (quick search).
     */
    public ContentEnvelope truncated(int max) {
        if (max <= 0 || items == null || items.size() <= max) return this;
        ContentEnvelope copy = copy();
        copy.items = new ArrayList<>(items.subList(0, max));
        return copy;
    }

    public ContentEnvelope withPlay(PlayDescriptor descriptor) {
        ContentEnvelope copy = copy();
        copy.play = descriptor;
        return copy;
    }

    private ContentEnvelope copy() {
        ContentEnvelope c = new ContentEnvelope();
        c.items = items == null ? new ArrayList<>() : new ArrayList<>(items);
        c.categories = categories == null ? new ArrayList<>() : new ArrayList<>(categories);
        c.filters = filters == null ? null : filters.deepCopy();
        c.page = page;
        c.pageCount = pageCount;
        c.limit = limit;
        c.total = total;
        c.play = play;
        c.status = status;
        c.errorKind = errorKind;
        c.message = message;
        return c;
    }

    @Override
    public String toString() {
        if (!isOk()) return "ContentEnvelope{" + status + ", " + errorKind + ": " + message + "}";
        return "ContentEnvelope{items=" + getItems().size() + ", categories=" + getCategories().size()
                + ", page=" + page + "/" + pageCount + (play != null ? ", play=" + play.url() : "") + "}";
    }

    public static final class Builder {
        private final ContentEnvelope e = new ContentEnvelope();

        private Builder() {
        }

        public Builder item(ContentItem item) { e.items.add(item); return this; }
        public Builder items(List<ContentItem> items) { if (items != null) e.items.addAll(items); return this; }
        public Builder category(Category category) { e.categories.add(category); return this; }
        public Builder categories(List<Category> categories) { if (categories != null) e.categories.addAll(categories); return this; }
        public Builder filters(JsonObject filters) { e.filters = filters; return this; }
        public Builder page(int page) { e.page = page; return this; }
        public Builder pageCount(int pageCount) { e.pageCount = pageCount; return this; }
        public Builder limit(int limit) { e.limit = limit; return this; }
        public Builder total(int total) { e.total = total; return this; }
        public Builder play(PlayDescriptor play) { e.play = play; return this; }

        public ContentEnvelope build() {
            return e.copy();
        }
    }
}
