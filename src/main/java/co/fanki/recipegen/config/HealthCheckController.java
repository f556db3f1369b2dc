package co.fanki.recipegen.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Health check controller providing liveness and readiness endpoints.
 *
 * <p>Provides /health for basic liveness check and /ready for readiness
 * check that verifies the archive database can be reached.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private static final Logger LOG = LoggerFactory.getLogger(
            HealthCheckController.class);

    private final DataSource dataSource;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theDataSource the data source for database connectivity checks
     */
    public HealthCheckController(final DataSource theDataSource) {
        this.dataSource = theDataSource;
    }

    /**
     * Liveness endpoint.
     *
     * @return "ok" string
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Readiness endpoint.
     *
     * <p>Verifies the archive database accepts connections.</p>
     *
     * @return status map with component health information
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final boolean databaseHealthy = checkDatabaseHealth();

        final Map<String, Object> status = Map.of(
            "status", databaseHealthy ? "ready" : "not_ready",
            "database", databaseHealthy ? "connected" : "disconnected"
        );

        if (databaseHealthy) {
            return ResponseEntity.ok(status);
        }
        return ResponseEntity.status(503).body(status);
    }

    private boolean checkDatabaseHealth() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(5);
        } catch (SQLException e) {
            LOG.warn("Archive database not reachable: {}", e.getMessage());
            return false;
        }
    }

}
