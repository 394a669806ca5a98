package com.libragraph.contentstore.core.health;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Ready when the search index table is reachable.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    AgroalDataSource dataSource;

    @Override
    public HealthCheckResponse call() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT count(*) FROM envelope_index")) {
            rs.next();
            return HealthCheckResponse.named("search-index")
                    .up()
                    .withData("documents", rs.getLong(1))
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("search-index")
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}
