package com.libragraph.contentstore.core.index;

import com.libragraph.contentstore.util.ContentId;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

/**
 * SearchIndex backed by a PostgreSQL {@code envelope_index} table with a JSONB
 * document column.
 */
@ApplicationScoped
public class JdbiSearchIndex implements SearchIndex {

    private static final Logger log = Logger.getLogger(JdbiSearchIndex.class);

    @Inject
    Jdbi jdbi;

    @Override
    public Uni<Void> upsert(IndexDocument document) {
        return Uni.createFrom().voidItem().invoke(() -> {
            try {
                jdbi.useExtension(EnvelopeIndexDao.class,
                        dao -> dao.upsert(document.contentId(), document.toJson()));
            } catch (RuntimeException e) {
                throw new IndexException("Failed to index envelope: " + document.contentId(), e);
            }
        });
    }

    @Override
    public Uni<Boolean> remove(ContentId contentId) {
        return Uni.createFrom().item(() -> {
            int deleted;
            try {
                deleted = jdbi.withExtension(EnvelopeIndexDao.class, dao -> dao.delete(contentId.value()));
            } catch (RuntimeException e) {
                throw new IndexException("Failed to unindex envelope: " + contentId, e);
            }
            log.debugf("Removed %d index document(s) for [%s]", deleted, contentId);
            return deleted > 0;
        });
    }
}
