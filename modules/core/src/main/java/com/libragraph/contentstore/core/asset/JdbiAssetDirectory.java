package com.libragraph.contentstore.core.asset;

import com.libragraph.contentstore.core.index.IndexException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AssetDirectory backed by the PostgreSQL {@code named_asset} table.
 */
@ApplicationScoped
public class JdbiAssetDirectory implements AssetDirectory {

    private static final Logger log = Logger.getLogger(JdbiAssetDirectory.class);

    @Inject
    Jdbi jdbi;

    @Override
    public Uni<Map<String, String>> enumerateNamed() {
        return Uni.createFrom().item(() -> {
            List<NamedAssetRecord> rows;
            try {
                rows = jdbi.withExtension(NamedAssetDao.class, NamedAssetDao::findAll);
            } catch (RuntimeException e) {
                throw new IndexException("Failed to enumerate named assets", e);
            }
            log.debugf("Enumerated %d named asset(s)", rows.size());
            Map<String, String> assets = new LinkedHashMap<>();
            for (NamedAssetRecord row : rows) {
                assets.put(row.name(), row.publicUrl());
            }
            return assets;
        });
    }

    @Override
    public Uni<Void> register(String name, String publicUrl) {
        return Uni.createFrom().voidItem().invoke(() -> {
            try {
                jdbi.useExtension(NamedAssetDao.class, dao -> dao.upsert(name, publicUrl));
            } catch (RuntimeException e) {
                throw new IndexException("Failed to register named asset: " + name, e);
            }
            log.debugf("Named asset [%s] -> %s", name, publicUrl);
        });
    }
}
