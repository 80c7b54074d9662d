package com.scorebot.db;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class UpsertResult {
    public final int written;
    public final int failed;
    public final Map<String, String> failures;

    public UpsertResult(int written, int failed, Map<String, String> failures) {
        this.written = Math.max(0, written);
        this.failed = Math.max(0, failed);
        this.failures = failures == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public static UpsertResult empty() {
        return new UpsertResult(0, 0, Map.of());
    }

    public UpsertResult plus(UpsertResult other) {
        Map<String, String> merged = new LinkedHashMap<>(failures);
        merged.putAll(other.failures);
        return new UpsertResult(written + other.written, failed + other.failed, merged);
    }
}
