package com.spiderhub.api;

import com.spiderhub.core.hook.HookRequest;
import com.spiderhub.core.hook.HookResponse;

import java.io.IOException;
import java.util.Map;

/**
 * Raw HTTP execution. TLS, proxies and DNS are the transport's business.
 */
public interface Transport {

    // Any HTTP status is returned as a response; only I/O failures throw.
    HookResponse execute(HookRequest request) throws IOException;

    byte[] download(String url, Map<String, String> headers) throws IOException;
}
