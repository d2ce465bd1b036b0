package com.github.anirbanmu.kookbridge.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

public class ConfigLoader {
    private static final Set<String> ACCOUNT_KEYS = Set.of(
        "enabled", "name", "token", "dmPolicy", "allowFrom", "groupPolicy", "groupAllowFrom",
        "requireMention", "textChunkLimit", "historyLimit", "groups");
    private static final Set<String> GROUP_KEYS = Set.of("enabled", "requireMention", "groupPolicy", "allowFrom");
    private static final Set<String> ROOT_KEYS = Set.of("kook", "messages");

    public static BridgeConfig load(Path path) throws IOException {
        TomlParseResult result = Toml.parse(path);
        return parse(result);
    }

    public static BridgeConfig load(InputStream stream) throws IOException {
        TomlParseResult result = Toml.parse(stream);
        return parse(result);
    }

    public static BridgeConfig load(String content) {
        TomlParseResult result = Toml.parse(content);
        return parse(result);
    }

    private static BridgeConfig parse(TomlParseResult result) {
        if (result.hasErrors()) {
            StringBuilder sb = new StringBuilder("Failed to parse TOML configuration:\n");
            result.errors().forEach(error -> sb.append("- ").append(error.toString()).append("\n"));
            throw new ConfigException(sb.toString());
        }

        rejectUnknownKeys(result, ROOT_KEYS, "");

        Integer historyLimit = null;
        TomlTable messages = table(result, "messages", "");
        if (messages != null) {
            rejectUnknownKeys(messages, Set.of("groupChat"), "messages");
            TomlTable groupChat = table(messages, "groupChat", "messages");
            if (groupChat != null) {
                rejectUnknownKeys(groupChat, Set.of("historyLimit"), "messages.groupChat");
                historyLimit = nonNegative(groupChat, "historyLimit", "messages.groupChat");
            }
        }

        TomlTable kook = table(result, "kook", "");
        if (kook == null) {
            return new BridgeConfig(AccountConfig.EMPTY, Map.of(), historyLimit);
        }

        Set<String> allowed = new HashSet<>(ACCOUNT_KEYS);
        allowed.add("accounts");
        rejectUnknownKeys(kook, allowed, "kook");
        AccountConfig base = parseAccount(kook, "kook");

        Map<String, AccountConfig> accounts = new LinkedHashMap<>();
        TomlTable accountsTable = table(kook, "accounts", "kook");
        if (accountsTable != null) {
            for (String id : accountsTable.keySet()) {
                String context = "kook.accounts." + id;
                TomlTable accountTable = table(accountsTable, id, "kook.accounts");
                rejectUnknownKeys(accountTable, ACCOUNT_KEYS, context);
                accounts.put(AccountResolver.normalizeAccountId(id), parseAccount(accountTable, context));
            }
        }

        return new BridgeConfig(base, Map.copyOf(accounts), historyLimit);
    }

    private static AccountConfig parseAccount(TomlTable table, String context) {
        Integer textChunkLimit = integer(table, "textChunkLimit", context);
        if (textChunkLimit != null && textChunkLimit < 1) {
            throw new ConfigException("'" + context + ".textChunkLimit' must be at least 1, got " + textChunkLimit);
        }

        Map<String, GroupConfig> groups = new LinkedHashMap<>();
        TomlTable groupsTable = table(table, "groups", context);
        if (groupsTable != null) {
            for (String key : groupsTable.keySet()) {
                String groupContext = context + ".groups." + key;
                TomlTable groupTable = table(groupsTable, key, context + ".groups");
                rejectUnknownKeys(groupTable, GROUP_KEYS, groupContext);
                groups.put(key, new GroupConfig(
                    bool(groupTable, "enabled", groupContext),
                    bool(groupTable, "requireMention", groupContext),
                    enumValue(groupTable, "groupPolicy", groupContext, GroupPolicy::fromString),
                    idList(groupTable, "allowFrom", groupContext)));
            }
        }

        return new AccountConfig(
            bool(table, "enabled", context),
            string(table, "name", context),
            blankToNull(string(table, "token", context)),
            enumValue(table, "dmPolicy", context, DmPolicy::fromString),
            idList(table, "allowFrom", context),
            enumValue(table, "groupPolicy", context, GroupPolicy::fromString),
            idList(table, "groupAllowFrom", context),
            bool(table, "requireMention", context),
            textChunkLimit,
            nonNegative(table, "historyLimit", context),
            Map.copyOf(groups));
    }

    private static void rejectUnknownKeys(TomlTable table, Set<String> allowed, String context) {
        for (String key : table.keySet()) {
            if (!allowed.contains(key)) {
                String where = context.isEmpty() ? key : context + "." + key;
                throw new ConfigException("Unknown configuration key '" + where + "'.");
            }
        }
    }

    // keys come from keySet(), so look them up as single path segments rather than dotted keys
    private static Object raw(TomlTable table, String key) {
        return table.get(List.of(key));
    }

    private static TomlTable table(TomlTable table, String key, String context) {
        Object value = raw(table, key);
        if (value == null) {
            return null;
        }
        if (value instanceof TomlTable t) {
            return t;
        }
        throw typeError(context, key, "a table", value);
    }

    private static Boolean bool(TomlTable table, String key, String context) {
        Object value = raw(table, key);
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        throw typeError(context, key, "a boolean", value);
    }

    private static String string(TomlTable table, String key, String context) {
        Object value = raw(table, key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw typeError(context, key, "a string", value);
    }

    private static Integer integer(TomlTable table, String key, String context) {
        Object value = raw(table, key);
        if (value == null) {
            return null;
        }
        if (value instanceof Long l && l <= Integer.MAX_VALUE && l >= Integer.MIN_VALUE) {
            return l.intValue();
        }
        throw typeError(context, key, "an integer", value);
    }

    private static Integer nonNegative(TomlTable table, String key, String context) {
        Integer value = integer(table, key, context);
        if (value != null && value < 0) {
            throw new ConfigException("'" + context + "." + key + "' must not be negative, got " + value);
        }
        return value;
    }

    private static <E> E enumValue(TomlTable table, String key, String context, Function<String, E> parser) {
        String value = string(table, key, context);
        if (value == null) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("'" + context + "." + key + "': " + e.getMessage());
        }
    }

    // ids may be written as strings or bare integers
    private static List<String> idList(TomlTable table, String key, String context) {
        Object value = raw(table, key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof TomlArray array)) {
            throw typeError(context, key, "an array", value);
        }
        List<String> ids = new ArrayList<>();
        for (Object entry : array.toList()) {
            if (entry instanceof String || entry instanceof Long) {
                ids.add(entry.toString().trim());
            } else {
                throw new ConfigException("'" + context + "." + key + "' entries must be strings or integers, got " + entry);
            }
        }
        return List.copyOf(ids);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static ConfigException typeError(String context, String key, String expected, Object actual) {
        String where = context.isEmpty() ? key : context + "." + key;
        return new ConfigException("'" + where + "' must be " + expected + ", got " + actual.getClass().getSimpleName());
    }
}
