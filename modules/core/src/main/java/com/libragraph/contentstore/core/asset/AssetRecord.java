package com.libragraph.contentstore.core.asset;

import com.libragraph.contentstore.util.ContentHash;

/**
 * Outcome of fingerprinting and publishing one asset. Immutable; a
 * fingerprinted name is never reused for different content.
 */
public record AssetRecord(
        String originalName,
        String fingerprintedName,
        String contentType,
        ContentHash digest,
        String publicUrl
) {}
