package com.spiderhub.core.aggregate;

import com.spiderhub.common.model.ContentEnvelope;
import com.spiderhub.common.model.Operation;
import com.spiderhub.common.model.Site;

import java.util.function.BiFunction;

/**
 * Page cursor for one category listing of one site. The page only advances on success,
 * so a failed {@link #loadMore()} can simply be called again.
 */
public class CategoryPager {
    private final Site site;
    private final Operation.Category first;
    private final BiFunction<Site, Operation, ContentEnvelope> loader;

    private int page;
    private int pageCount;
    private boolean hasMore = true;

    public CategoryPager(Site site, Operation.Category first, BiFunction<Site, Operation, ContentEnvelope> loader) {
        this.site = site;
        this.first = first;
        this.loader = loader;
        this.page = first.page() - 1;
    }

    /**
     * Loads the next page. Returns an empty envelope once the last page has been served.
     */
    public synchronized ContentEnvelope loadMore() {
        if (!hasMore) {
            return ContentEnvelope.empty();
        }

        int next = page + 1;
        ContentEnvelope envelope = loader.apply(site, first.withPage(next));
        if (!envelope.isOk()) {
            return envelope;
        }

        page = next;
        pageCount = envelope.getPageCount();
        if (pageCount > 0) {
            hasMore = page < pageCount;
        } else {
            // unknown page count: keep going until a page comes back empty
            hasMore = !envelope.getItems().isEmpty();
        }
        return envelope;
    }

    public synchronized boolean hasMore() {
        return hasMore;
    }

    /**
     * Last page successfully loaded, 0 before the first.
     */
    public synchronized int getPage() {
        return page;
    }

    public synchronized int getPageCount() {
        return pageCount;
    }

    public Site getSite() {
        return site;
    }

    public String getTypeId() {
        return first.typeId();
    }

    public synchronized void reset() {
        page = first.page() - 1;
        pageCount = 0;
        hasMore = true;
    }
}
