package com.github.anirbanmu.kookbridge.util;

import com.dslplatform.json.DslJson;
import com.dslplatform.json.runtime.Settings;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public final class Json {
    // null fields are left out so optional request fields (quote, chat_code) are not sent
    public static final DslJson<Object> DSL = new DslJson<>(Settings.withRuntime()
        .includeServiceLoader()
        .skipDefaultValues(true));

    private Json() {
    }

    public static byte[] toBytes(Object value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DSL.serialize(value, out);
        return out.toByteArray();
    }

    public static String toString(Object value) throws IOException {
        return new String(toBytes(value), StandardCharsets.UTF_8);
    }

    public static <T> T read(Class<T> type, byte[] bytes) throws IOException {
        T value = DSL.deserialize(type, new ByteArrayInputStream(bytes));
        if (value == null) {
            throw new IOException("empty json for " + type.getSimpleName());
        }
        return value;
    }
}
