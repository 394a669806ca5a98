package com.libragraph.contentstore.core.asset;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(NamedAssetRecord.class)
public interface NamedAssetDao {

    @SqlUpdate("CREATE TABLE IF NOT EXISTS named_asset (" +
            "name TEXT PRIMARY KEY, " +
            "public_url TEXT NOT NULL, " +
            "updated_at TIMESTAMPTZ NOT NULL DEFAULT now())")
    void createTable();

    @SqlQuery("SELECT name, public_url FROM named_asset ORDER BY name")
    List<NamedAssetRecord> findAll();

    @SqlUpdate("INSERT INTO named_asset (name, public_url) VALUES (:name, :publicUrl) " +
            "ON CONFLICT (name) DO UPDATE SET public_url = EXCLUDED.public_url, updated_at = now()")
    void upsert(@Bind("name") String name, @Bind("publicUrl") String publicUrl);
}
