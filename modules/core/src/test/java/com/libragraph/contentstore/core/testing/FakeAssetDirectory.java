package com.libragraph.contentstore.core.testing;

import com.libragraph.contentstore.core.asset.AssetDirectory;
import io.smallrye.mutiny.Uni;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed AssetDirectory. Enumeration is sorted by name.
 */
public class FakeAssetDirectory implements AssetDirectory {

    private final Map<String, String> named = new ConcurrentHashMap<>();

    private volatile RuntimeException enumerateFailure;
    private volatile RuntimeException registerFailure;

    public void failEnumerateWith(RuntimeException failure) {
        this.enumerateFailure = failure;
    }

    public void failRegisterWith(RuntimeException failure) {
        this.registerFailure = failure;
    }

    public FakeAssetDirectory put(String name, String publicUrl) {
        named.put(name, publicUrl);
        return this;
    }

    public String get(String name) {
        return named.get(name);
    }

    @Override
    public Uni<Map<String, String>> enumerateNamed() {
        RuntimeException injected = enumerateFailure;
        if (injected != null) {
            return Uni.createFrom().failure(injected);
        }
        return Uni.createFrom().item(() -> new TreeMap<>(named));
    }

    @Override
    public Uni<Void> register(String name, String publicUrl) {
        RuntimeException injected = registerFailure;
        if (injected != null) {
            return Uni.createFrom().failure(injected);
        }
        return Uni.createFrom().voidItem().invoke(() -> named.put(name, publicUrl));
    }
}
