package com.github.anirbanmu.kookbridge.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Merges the global {@code [kook]} section with {@code [kook.accounts.<id>]} overrides.
 *
 * <p>Nothing is cached: every {@link #resolve(String)} reads the current config snapshot, so a
 * reloaded config is picked up by the next event.
 */
public class AccountResolver {
    public static final String DEFAULT_ACCOUNT_ID = "default";
    public static final String TOKEN_ENV = "KOOK_BOT_TOKEN";
    public static final int DEFAULT_TEXT_CHUNK_LIMIT = 4000;
    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private final Supplier<BridgeConfig> config;
    private final Function<String, String> env;

    public AccountResolver(Supplier<BridgeConfig> config) {
        this(config, System::getenv);
    }

    public AccountResolver(Supplier<BridgeConfig> config, Function<String, String> env) {
        this.config = config;
        this.env = env;
    }

    public static String normalizeAccountId(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            return DEFAULT_ACCOUNT_ID;
        }
        return accountId.trim().toLowerCase();
    }

    public List<String> listAccountIds() {
        List<String> ids = new ArrayList<>(config.get().accounts().keySet());
        if (ids.isEmpty()) {
            return List.of(DEFAULT_ACCOUNT_ID);
        }
        ids.sort(String::compareTo);
        return List.copyOf(ids);
    }

    public String defaultAccountId() {
        List<String> ids = listAccountIds();
        return ids.contains(DEFAULT_ACCOUNT_ID) ? DEFAULT_ACCOUNT_ID : ids.get(0);
    }

    public List<ResolvedAccount> listEnabledAccounts() {
        List<ResolvedAccount> enabled = new ArrayList<>();
        for (String id : listAccountIds()) {
            ResolvedAccount account = resolve(id);
            if (account.enabled()) {
                enabled.add(account);
            }
        }
        return enabled;
    }

    public ResolvedAccount resolve(String accountId) {
        String id = normalizeAccountId(accountId);
        BridgeConfig snapshot = config.get();
        AccountConfig base = snapshot.kook();
        AccountConfig account = snapshot.accounts().getOrDefault(id, AccountConfig.EMPTY);
        boolean isDefault = DEFAULT_ACCOUNT_ID.equals(id);

        boolean enabled = !Boolean.FALSE.equals(base.enabled()) && !Boolean.FALSE.equals(account.enabled());

        // a top-level token only ever belongs to the default account
        String token = account.token();
        ResolvedAccount.TokenSource source = token != null ? ResolvedAccount.TokenSource.CONFIG : ResolvedAccount.TokenSource.NONE;
        if (token == null && isDefault) {
            if (base.token() != null) {
                token = base.token();
                source = ResolvedAccount.TokenSource.CONFIG;
            } else {
                String fromEnv = env.apply(TOKEN_ENV);
                if (fromEnv != null && !fromEnv.isBlank()) {
                    token = fromEnv.trim();
                    source = ResolvedAccount.TokenSource.ENV;
                }
            }
        }

        Integer historyLimit = first(account.historyLimit(), base.historyLimit(), snapshot.groupHistoryLimit());

        return new ResolvedAccount(
            id,
            enabled,
            token != null,
            first(account.name(), isDefault ? base.name() : null, null),
            token,
            source,
            first(account.dmPolicy(), base.dmPolicy(), DmPolicy.PAIRING),
            first(account.allowFrom(), base.allowFrom(), List.of()),
            first(account.groupPolicy(), base.groupPolicy(), GroupPolicy.ALLOWLIST),
            first(account.groupAllowFrom(), base.groupAllowFrom(), List.of()),
            first(account.requireMention(), base.requireMention(), Boolean.TRUE),
            first(account.textChunkLimit(), base.textChunkLimit(), DEFAULT_TEXT_CHUNK_LIMIT),
            Math.max(0, historyLimit != null ? historyLimit : DEFAULT_HISTORY_LIMIT),
            mergeGroups(base.groups(), account.groups()));
    }

    private static Map<String, GroupConfig> mergeGroups(Map<String, GroupConfig> base, Map<String, GroupConfig> account) {
        Map<String, GroupConfig> merged = new HashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (account != null) {
            merged.putAll(account);
        }
        return Map.copyOf(merged);
    }

    private static <T> T first(T preferred, T fallback, T defaultValue) {
        if (preferred != null) {
            return preferred;
        }
        return fallback != null ? fallback : defaultValue;
    }
}
