package com.github.anirbanmu.kookbridge;

import com.github.anirbanmu.kookbridge.config.AccountResolver;
import com.github.anirbanmu.kookbridge.config.BridgeConfig;
import com.github.anirbanmu.kookbridge.config.ConfigException;
import com.github.anirbanmu.kookbridge.config.ConfigLoader;
import com.github.anirbanmu.kookbridge.config.ResolvedAccount;
import com.github.anirbanmu.kookbridge.host.LoopbackHost;
import com.github.anirbanmu.kookbridge.kook.Cancellation;
import com.github.anirbanmu.kookbridge.kook.KookHttpClient;
import com.github.anirbanmu.kookbridge.kook.KookMonitor;
import com.github.anirbanmu.kookbridge.kook.KookProbe;
import com.github.anirbanmu.kookbridge.log.Log;
import com.github.anirbanmu.kookbridge.util.Threads;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

public class Main {
    public static void main(String[] args) {
        String configPathStr = System.getProperty("config", "kook.toml");
        Path configPath = Path.of(configPathStr);

        BridgeConfig config;
        if (Files.exists(configPath)) {
            try {
                config = ConfigLoader.load(configPath);
                Log.info("startup.config_loaded", "path", configPath.toAbsolutePath().toString(), "accounts", config.accounts().size());
            } catch (Exception e) {
                Log.error("startup.config_error", e);
                System.exit(1);
                return;
            }
        } else {
            // env token alone is enough for the default account
            Log.warn("startup.missing_config", "path", configPath.toAbsolutePath().toString());
            config = BridgeConfig.EMPTY;
        }

        BridgeConfig loaded = config;
        AccountResolver resolver = new AccountResolver(() -> loaded);
        String accountId = System.getProperty("account");

        Log.info("bot_startup", "status", "starting", "version", "1.0.0");
        probeAccounts(resolver, accountId);

        KookMonitor monitor = new KookMonitor(resolver, new LoopbackHost());
        Cancellation cancellation = new Cancellation();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("shutdown.requested");
            cancellation.cancel();
        }, "shutdown"));

        int healthPort = Integer.parseInt(System.getenv().getOrDefault("HEALTH_PORT", "8080"));
        try {
            startHealthCheck(healthPort, monitor::isHealthy);
        } catch (Exception e) {
            Log.error("startup.health_server_failed", e);
            System.exit(1);
        }

        CompletableFuture<Void> done;
        try {
            done = monitor.start(accountId, cancellation);
        } catch (ConfigException e) {
            Log.error("startup.account_error", "message", e.getMessage());
            System.exit(1);
            return;
        }

        try {
            done.join();
        } catch (CompletionException e) {
            Log.error("shutdown.account_failed", e.getCause());
            System.exit(1);
        }
        Log.info("shutdown.complete");
    }

    // log-only: a bad token should show up at startup, but the gateway retries on its own
    private static void probeAccounts(AccountResolver resolver, String accountId) {
        List<ResolvedAccount> accounts = accountId != null
            ? List.of(resolver.resolve(accountId))
            : resolver.listEnabledAccounts();
        for (ResolvedAccount account : accounts) {
            if (!account.configured()) {
                continue;
            }
            KookProbe.ProbeResult result = KookProbe.probe(new KookHttpClient(account.token()));
            if (result.ok()) {
                Log.info("startup.probe_ok", "account", account.accountId(), "bot_id", result.botId(), "bot_name", result.botName());
            } else {
                Log.warn("startup.probe_failed", "account", account.accountId(), "error", result.error());
            }
        }
    }

    private static void startHealthCheck(int port, BooleanSupplier healthy) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(Executors.newCachedThreadPool(Threads.daemonFactory("health")));
        server.createContext("/health", exchange -> {
            boolean ok = healthy.getAsBoolean();
            int status = ok ? 200 : 503;
            byte[] body = (ok ? "ok" : "unhealthy").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        Log.info("health.started", "port", port);
    }
}
