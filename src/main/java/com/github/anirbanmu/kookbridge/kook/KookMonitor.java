package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.config.AccountResolver;
import com.github.anirbanmu.kookbridge.config.ConfigException;
import com.github.anirbanmu.kookbridge.config.ResolvedAccount;
import com.github.anirbanmu.kookbridge.host.HostRuntime;
import com.github.anirbanmu.kookbridge.inbound.EventAdmission;
import com.github.anirbanmu.kookbridge.inbound.MessageHandler;
import com.github.anirbanmu.kookbridge.inbound.PendingHistory;
import com.github.anirbanmu.kookbridge.log.Log;
import com.github.anirbanmu.kookbridge.util.Threads;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Entry point that brings accounts online. Every account gets its own rest client, history, handler
 * pool, admission pipeline and reconnect loop on a thread of its own; accounts share nothing.
 */
public class KookMonitor {
    private static final Duration HANDLER_GRACE = Duration.ofSeconds(5);

    private final AccountResolver resolver;
    private final HostRuntime host;
    private final Function<String, KookApi> apiFactory;
    private final GatewayConnector connector;
    private final GatewayTimings timings;
    private final Function<String, ExecutorService> handlerPools;
    private final List<PersistentGateway> gateways = new CopyOnWriteArrayList<>();

    public KookMonitor(AccountResolver resolver, HostRuntime host) {
        this(resolver, host, KookHttpClient::new, GatewayConnector.websocket(), GatewayTimings.DEFAULT);
    }

    public KookMonitor(AccountResolver resolver, HostRuntime host, Function<String, KookApi> apiFactory, GatewayConnector connector, GatewayTimings timings) {
        this(resolver, host, apiFactory, connector, timings,
            id -> Executors.newCachedThreadPool(Threads.daemonFactory("kook-handler-" + id)));
    }

    KookMonitor(
        AccountResolver resolver,
        HostRuntime host,
        Function<String, KookApi> apiFactory,
        GatewayConnector connector,
        GatewayTimings timings,
        Function<String, ExecutorService> handlerPools) {
        this.handlerPools = handlerPools;
        this.resolver = resolver;
        this.host = host;
        this.apiFactory = apiFactory;
        this.connector = connector;
        this.timings = timings;
    }

    /**
     * Starts one account, or every enabled account when {@code accountId} is null. Configuration
     * problems throw {@link ConfigException} before anything connects. The returned future
     * completes once every started account has stopped.
     */
    public CompletableFuture<Void> start(String accountId, Cancellation cancellation) {
        List<ResolvedAccount> accounts = accountsToStart(accountId);
        if (accounts.isEmpty()) {
            Log.warn("monitor.no_enabled_accounts");
            return CompletableFuture.completedFuture(null);
        }

        List<CompletableFuture<Void>> running = new ArrayList<>();
        for (ResolvedAccount account : accounts) {
            running.add(startAccount(account, cancellation));
        }
        return CompletableFuture.allOf(running.toArray(new CompletableFuture[0]));
    }

    private List<ResolvedAccount> accountsToStart(String accountId) {
        if (accountId != null) {
            ResolvedAccount account = resolver.resolve(accountId);
            if (!account.enabled()) {
                throw new ConfigException("KOOK account '" + account.accountId() + "' is disabled.");
            }
            if (!account.configured()) {
                throw new ConfigException("KOOK account '" + account.accountId() + "' has no bot token. Set 'token' or "
                    + AccountResolver.TOKEN_ENV + ".");
            }
            return List.of(account);
        }

        List<ResolvedAccount> enabled = resolver.listEnabledAccounts();
        for (ResolvedAccount account : enabled) {
            if (!account.configured()) {
                throw new ConfigException("KOOK account '" + account.accountId() + "' is enabled but has no bot token.");
            }
        }
        return enabled;
    }

    private CompletableFuture<Void> startAccount(ResolvedAccount account, Cancellation cancellation) {
        String id = account.accountId();
        KookApi api = apiFactory.apply(account.token());
        PendingHistory history = new PendingHistory();
        MessageHandler handler = new MessageHandler(id, resolver, history, host, new KookSender(api));
        EventAdmission admission = new EventAdmission(id, handler, handlerPools.apply(id));
        PersistentGateway gateway = new PersistentGateway(id, api, connector, timings, admission);
        gateways.add(gateway);

        CompletableFuture<Void> done = new CompletableFuture<>();
        Threads.startDaemon("kook-gateway-" + id, () -> {
            Log.info("monitor.account_started", "account", id, "token_source", account.tokenSource());
            RuntimeException failure = null;
            try {
                gateway.run(cancellation);
            } catch (RuntimeException ex) {
                Log.error("monitor.account_failed", ex, "account", id);
                failure = ex;
            } finally {
                admission.shutdown(HANDLER_GRACE);
                gateways.remove(gateway);
            }
            if (failure == null) {
                done.complete(null);
            } else {
                done.completeExceptionally(failure);
            }
        });
        return done;
    }

    // healthy when at least one account runs and all of them are live
    public boolean isHealthy() {
        if (gateways.isEmpty()) {
            return false;
        }
        for (PersistentGateway gateway : gateways) {
            if (!gateway.isHealthy()) {
                return false;
            }
        }
        return true;
    }
}
