package com.libragraph.contentstore.core.asset;

import io.smallrye.mutiny.Uni;

import java.util.Map;

/**
 * Directory of named assets: a stable variable name (e.g. {@code logo}) mapped
 * to the public URL of the asset currently published under it. Injected into
 * every retrieved envelope as its {@code assets} field.
 */
public interface AssetDirectory {

    /**
     * Returns all named assets, name to public URL.
     */
    Uni<Map<String, String>> enumerateNamed();

    /**
     * Points a name at a public URL, replacing any previous mapping.
     */
    Uni<Void> register(String name, String publicUrl);
}
