package com.libragraph.contentstore.core.asset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a batch publish: original name to public URL, in upload order.
 */
public record AssetSummary(List<AssetRecord> records) {

    public AssetSummary {
        records = List.copyOf(records);
    }

    public Map<String, String> publicUrls() {
        Map<String, String> urls = new LinkedHashMap<>();
        for (AssetRecord record : records) {
            urls.put(record.originalName(), record.publicUrl());
        }
        return Collections.unmodifiableMap(urls);
    }
}
