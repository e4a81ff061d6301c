package com.spiderhub.core.hook;

import com.spiderhub.core.config.EngineConfig;
import com.spiderhub.core.hook.builtin.CacheControlHook;
import com.spiderhub.core.hook.builtin.ContentTypeHook;
import com.spiderhub.core.hook.builtin.EncodingHook;
import com.spiderhub.core.hook.builtin.MediaClassifierHook;
import com.spiderhub.core.hook.builtin.PlayUrlOptimizerHook;
import com.spiderhub.core.hook.builtin.RefererHook;
import com.spiderhub.core.hook.builtin.RetryMarkerHook;
import com.spiderhub.core.hook.builtin.UserAgentHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the request, response and player-URL chains and the threads hooks run on.
 */
public class HookManager {
    private static final Logger logger = LoggerFactory.getLogger(HookManager.class);

    private final ExecutorService hookExecutor;
    private final HookChain<HookRequest> requestChain;
    private final HookChain<HookResponse> responseChain;
    private final HookChain<HookPlayerUrl> playerChain;

    public HookManager(EngineConfig config) {
        AtomicInteger counter = new AtomicInteger();
        this.hookExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "Hook-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.requestChain = new HookChain<>(HookPhase.REQUEST, hookExecutor, config.hookTimeoutMs);
        this.responseChain = new HookChain<>(HookPhase.RESPONSE, hookExecutor, config.hookTimeoutMs);
        this.playerChain = new HookChain<>(HookPhase.PLAYER, hookExecutor, config.hookTimeoutMs);

        if (config.builtInHooks) {
            registerBuiltIns(config);
        }
    }

    private void registerBuiltIns(EngineConfig config) {
        requestChain.register(new UserAgentHook(config.userAgent, config.userAgentByHost));
        requestChain.register(new RefererHook(config.refererByHost));
        requestChain.register(new CacheControlHook());

        responseChain.register(new ContentTypeHook());
        responseChain.register(new EncodingHook());
        responseChain.register(new RetryMarkerHook());

        playerChain.register(new PlayUrlOptimizerHook(config.tlsHostMarkers, config.refererByHost));
        playerChain.register(new MediaClassifierHook(config.userAgent));

        logger.info("🪝 Built-in hooks registered: {} request, {} response, {} player",
                requestChain.getHooks().size(), responseChain.getHooks().size(), playerChain.getHooks().size());
    }

    public void registerRequestHook(Hook<HookRequest> hook) { requestChain.register(hook); }
    public void registerResponseHook(Hook<HookResponse> hook) { responseChain.register(hook); }
    public void registerPlayerHook(Hook<HookPlayerUrl> hook) { playerChain.register(hook); }

    public HookChain<HookRequest> getRequestChain() { return requestChain; }
    public HookChain<HookResponse> getResponseChain() { return responseChain; }
    public HookChain<HookPlayerUrl> getPlayerChain() { return playerChain; }

    public HookRequest processRequest(String siteKey, HookRequest request) {
        return requestChain.run(request, new HookContext(siteKey, request.getUrl(), HookPhase.REQUEST));
    }

    public HookResponse processResponse(String siteKey, HookResponse response) {
        return responseChain.run(response, new HookContext(siteKey, response.getUrl(), HookPhase.RESPONSE));
    }

    public HookPlayerUrl processPlayerUrl(String siteKey, HookPlayerUrl playerUrl) {
        return playerChain.run(playerUrl, new HookContext(siteKey, playerUrl.getUrl(), HookPhase.PLAYER));
    }

    /**
     * Per-hook stats keyed by {@code phase/hookName}.
     */
    public Map<String, HookStats.Snapshot> stats() {
        Map<String, HookStats.Snapshot> out = new LinkedHashMap<>();
        requestChain.stats().forEach((k, v) -> out.put("request/" + k, v));
        responseChain.stats().forEach((k, v) -> out.put("response/" + k, v));
        playerChain.stats().forEach((k, v) -> out.put("player/" + k, v));
        return out;
    }

    public void clearStats() {
        requestChain.clearStats();
        responseChain.clearStats();
        playerChain.clearStats();
    }

    public void shutdown() {
        hookExecutor.shutdownNow();
    }
}
