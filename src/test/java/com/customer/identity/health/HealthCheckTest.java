package com.customer.identity.health;

import com.customer.identity.store.memory.InMemorySyncCursorRepository;
import com.customer.identity.sync.SyncCursorStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    private static HealthCheck fixed(String name, HealthStatus status) {
        return new HealthCheck() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public HealthStatus check() {
                return status;
            }
        };
    }

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("up() should create UP status")
        void upFactory() {
            HealthStatus status = HealthStatus.up();
            assertTrue(status.isUp());
            assertFalse(status.isDown());
            assertFalse(status.isDegraded());
            assertEquals("OK", status.message());
        }

        @Test
        @DisplayName("down() and degraded() should carry the reason")
        void failureFactories() {
            assertEquals("Database unreachable", HealthStatus.down("Database unreachable").message());
            assertTrue(HealthStatus.degraded("Cursor errors").isDegraded());
        }

        @Test
        @DisplayName("withDetail() should return a copy with the extra detail")
        void withDetail() {
            HealthStatus base = HealthStatus.up();
            HealthStatus detailed = base.withDetail("latencyMs", 3L);

            assertTrue(base.details().isEmpty());
            assertEquals(3L, detailed.details().get("latencyMs"));
        }

        @Test
        @DisplayName("Statuses are ordered UP, DEGRADED, DOWN")
        void ordering() {
            assertTrue(HealthStatus.down("x").isWorseThan(HealthStatus.degraded("y")));
            assertTrue(HealthStatus.degraded("y").isWorseThan(HealthStatus.up()));
            assertFalse(HealthStatus.up().isWorseThan(HealthStatus.up()));
        }

        @Test
        @DisplayName("worse keeps the first status on a tie")
        void worse() {
            HealthStatus first = HealthStatus.degraded("first");
            HealthStatus second = HealthStatus.degraded("second");

            assertSame(first, first.worse(second));
            assertSame(second, HealthStatus.up().worse(second));
            assertEquals("down", first.worse(HealthStatus.down("down")).message());
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Empty registry reports UP")
        void emptyRegistry() {
            HealthStatus status = new HealthCheckRegistry().checkAll();
            assertTrue(status.isUp());
            assertEquals("No health checks registered", status.message());
        }

        @Test
        @DisplayName("The worst check determines the aggregate status")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("database", HealthStatus.up()));
            registry.register(fixed("syncCursors", HealthStatus.degraded("Sources with errors: marketplace_order")));
            registry.register(null);

            HealthStatus status = registry.checkAll();

            assertEquals(2, registry.size());
            assertTrue(status.isDegraded());
            assertEquals("syncCursors: Sources with errors: marketplace_order", status.message());
            @SuppressWarnings("unchecked")
            Map<String, Object> database = (Map<String, Object>) status.details().get("database");
            assertEquals("UP", database.get("status"));
        }

        @Test
        @DisplayName("All checks up reports OK")
        void allUp() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("database", HealthStatus.up()));

            assertEquals("OK", registry.checkAll().message());
        }

        @Test
        @DisplayName("A check that throws is reported DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            });

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            assertEquals("broken: Health check threw: boom", status.message());
        }
    }

    @Nested
    @DisplayName("DatabaseHealthCheck")
    class DatabaseTests {

        @Test
        @DisplayName("A valid connection reports UP with latency")
        void validConnection() throws SQLException {
            DataSource dataSource = mock(DataSource.class);
            Connection connection = mock(Connection.class);
            when(dataSource.getConnection()).thenReturn(connection);
            when(connection.isValid(anyInt())).thenReturn(true);

            HealthStatus status = new DatabaseHealthCheck(dataSource).check();

            assertTrue(status.isUp());
            assertTrue(status.details().containsKey("latencyMs"));
            verify(connection).close();
        }

        @Test
        @DisplayName("An invalid connection reports DOWN")
        void invalidConnection() throws SQLException {
            DataSource dataSource = mock(DataSource.class);
            Connection connection = mock(Connection.class);
            when(dataSource.getConnection()).thenReturn(connection);
            when(connection.isValid(anyInt())).thenReturn(false);

            assertTrue(new DatabaseHealthCheck(dataSource).check().isDown());
        }

        @Test
        @DisplayName("A connection failure reports DOWN with the SQL state")
        void connectionFailure() throws SQLException {
            DataSource dataSource = mock(DataSource.class);
            when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

            HealthStatus status = new DatabaseHealthCheck(dataSource).check();

            assertTrue(status.isDown());
            assertEquals("Database connection failed: Connection refused", status.message());
            assertEquals("08001", status.details().get("sqlState"));
            assertEquals("database", new DatabaseHealthCheck(dataSource).getName());
        }
    }

    @Nested
    @DisplayName("SyncCursorHealthCheck")
    class SyncCursorTests {

        @Test
        @DisplayName("Cursor errors degrade health until a clean batch clears them")
        void cursorErrors() {
            SyncCursorStore store = new SyncCursorStore(new InMemorySyncCursorRepository(), new ObjectMapper());
            SyncCursorHealthCheck check = new SyncCursorHealthCheck(store);
            store.updateCursor("storefront_customer", 10, 10, null);

            assertTrue(check.check().isUp());

            store.recordError("marketplace_order", "fetch failed: HTTP 503");
            HealthStatus degraded = check.check();
            assertTrue(degraded.isDegraded());
            assertEquals("Sources with errors: marketplace_order", degraded.message());
            assertEquals(2, degraded.details().get("sources"));
            assertEquals(List.of("marketplace_order"), degraded.details().get("failing"));

            store.updateCursor("marketplace_order", 5, 5, null);
            assertTrue(check.check().isUp());
        }
    }
}
