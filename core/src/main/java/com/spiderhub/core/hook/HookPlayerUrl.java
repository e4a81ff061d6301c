package com.spiderhub.core.hook;

import com.spiderhub.common.model.MediaKind;
import com.spiderhub.common.model.PlayDescriptor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A resolved play URL on its way to the player.
 */
public class HookPlayerUrl implements HookValue<HookPlayerUrl> {
    private String url;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private boolean needsParse;
    private String flag;
    private MediaKind mediaKind = MediaKind.UNKNOWN;

    public HookPlayerUrl(String url) {
        this.url = url;
    }

    public static HookPlayerUrl from(PlayDescriptor descriptor) {
        HookPlayerUrl p = new HookPlayerUrl(descriptor.url());
        p.headers.putAll(descriptor.headers());
        p.needsParse = descriptor.needsParse();
        p.flag = descriptor.flag();
        p.mediaKind = descriptor.mediaKind();
        return p;
    }

    public PlayDescriptor toDescriptor() {
        return new PlayDescriptor(url, headers, needsParse, flag, mediaKind);
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public Map<String, String> getHeaders() { return headers; }
    public boolean isNeedsParse() { return needsParse; }
    public void setNeedsParse(boolean needsParse) { this.needsParse = needsParse; }
    public String getFlag() { return flag; }
    public void setFlag(String flag) { this.flag = flag; }
    public MediaKind getMediaKind() { return mediaKind; }
    public void setMediaKind(MediaKind mediaKind) { this.mediaKind = mediaKind; }

    @Override
    public HookPlayerUrl copy() {
        HookPlayerUrl c = new HookPlayerUrl(url);
        c.headers.putAll(headers);
        c.needsParse = needsParse;
        c.flag = flag;
        c.mediaKind = mediaKind;
        return c;
    }

    @Override
    public String toString() {
        return url + (needsParse ? " (parse)" : "");
    }
}
