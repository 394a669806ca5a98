package com.libragraph.contentstore.core.asset;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record NamedAssetRecord(
        @ColumnName("name") String name,
        @ColumnName("public_url") String publicUrl
) {}
