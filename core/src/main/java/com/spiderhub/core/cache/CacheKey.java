package com.spiderhub.core.cache;

import com.spiderhub.common.model.Operation;
import com.spiderhub.common.model.Site;

/**
 * {@code siteKey|operation|canonicalArgs}. Logically identical calls produce equal keys.
 */
public record CacheKey(String siteKey, String operation, String signature) {

    public static CacheKey of(Site site, Operation operation) {
        return new CacheKey(site.getKey(), operation.type().key(), operation.signature());
    }

    public static String sitePrefix(String siteKey) {
        return siteKey + "|";
    }

    public String asString() {
        return siteKey + "|" + operation + "|" + signature;
    }

    @Override
    public String toString() {
        return asString();
    }
}
