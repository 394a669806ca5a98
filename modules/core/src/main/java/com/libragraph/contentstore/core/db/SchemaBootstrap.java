package com.libragraph.contentstore.core.db;

import com.libragraph.contentstore.core.asset.NamedAssetDao;
import com.libragraph.contentstore.core.index.EnvelopeIndexDao;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

/**
 * Creates the search index and asset directory tables at boot if they are missing.
 */
@ApplicationScoped
@Startup
public class SchemaBootstrap {

    private static final Logger log = Logger.getLogger(SchemaBootstrap.class);

    @Inject
    Jdbi jdbi;

    @PostConstruct
    void init() {
        jdbi.useTransaction(h -> {
            EnvelopeIndexDao index = h.attach(EnvelopeIndexDao.class);
            index.createTable();
            index.createDocumentIndex();
            h.attach(NamedAssetDao.class).createTable();
        });
        String version = jdbi.withHandle(h -> h.createQuery("SELECT version()").mapTo(String.class).one());
        log.infof("Schema ready on: %s", version);
    }
}
