package cloud.adauth.store;

import cloud.adauth.AuthException;
import cloud.adauth.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteSessionStoreTest {

    private Connection connection;
    private SqliteSessionStore store;

    @BeforeEach
    void setUp() throws Exception {
        connection = DriverManager.getConnection("jdbc:sqlite::memory:");
        store = new SqliteSessionStore(connection);
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
        connection.close();
    }

    @Test
    void findReturnsEmptyForUnknownIdentity() throws Exception {
        assertTrue(store.find("nobody@example.com").isEmpty());
        assertTrue(store.find("").isEmpty());
    }

    @Test
    void roundTripsGroupsOrderIndependent() throws Exception {
        store.upsert(session("alice@example.com", "access-1", List.of("g1", "g2")));

        Session loaded = store.find("alice@example.com").orElseThrow();

        assertEquals(Set.of("g2", "g1"), loaded.getGroups());
        assertEquals("access-1", loaded.getAccessToken());
        assertEquals("refresh-1", loaded.getRefreshToken());
        assertEquals(1_700_000_000L, loaded.getExpiresOn());
        assertEquals("Bearer", loaded.getTokenType());
        assertEquals("https://graph.windows.net", loaded.getResource());
        assertEquals("user_impersonation", loaded.getScope());
    }

    @Test
    void upsertIsIdempotent() throws Exception {
        Session session = session("alice@example.com", "access-1", List.of("g1", "g2"));

        store.upsert(session);
        store.upsert(session);

        assertEquals(Optional.of(session), store.find("alice@example.com"));
        assertEquals(1, countRows("sessions"));
        assertEquals(2, countRows("session_groups"));
    }

    @Test
    void upsertFullyReplacesPriorRow() throws Exception {
        store.upsert(session("alice@example.com", "access-1", List.of("g1", "g2")));
        store.upsert(session("alice@example.com", "access-2", List.of("g3")));

        Session loaded = store.find("alice@example.com").orElseThrow();

        assertEquals("access-2", loaded.getAccessToken());
        assertEquals(Set.of("g3"), loaded.getGroups());
    }

    @Test
    void groupIdsMayContainFormerDelimiter() throws Exception {
        store.upsert(session("alice@example.com", "access-1", List.of("a;b", "c")));

        assertEquals(Set.of("a;b", "c"), store.find("alice@example.com").orElseThrow().getGroups());
    }

    @Test
    void sessionsAreKeyedByIdentity() throws Exception {
        store.upsert(session("alice@example.com", "access-a", List.of("g1")));
        store.upsert(session("bob@example.com", "access-b", List.of("g2")));

        assertEquals("access-a", store.find("alice@example.com").orElseThrow().getAccessToken());
        assertEquals(Set.of("g2"), store.find("bob@example.com").orElseThrow().getGroups());
    }

    @Test
    void concurrentUpsertsNeverMixRows() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String marker = "w" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    store.upsert(session("alice@example.com", "access-" + marker, List.of("group-" + marker)));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        Session loaded = store.find("alice@example.com").orElseThrow();
        String marker = loaded.getAccessToken().substring("access-".length());
        assertEquals(Set.of("group-" + marker), loaded.getGroups());
        assertEquals(1, countRows("session_groups"));
    }

    @Test
    void persistsAcrossStoreInstances(@TempDir Path dir) throws Exception {
        String url = "jdbc:sqlite:" + dir.resolve("sessions.db");
        try (SqliteSessionStore first = new SqliteSessionStore(url)) {
            first.upsert(session("alice@example.com", "access-1", List.of("g1")));
        }
        try (SqliteSessionStore second = new SqliteSessionStore(url)) {
            assertEquals(Set.of("g1"), second.find("alice@example.com").orElseThrow().getGroups());
        }
    }

    @Test
    void sharedConnectionIsLeftOpen() throws Exception {
        store.upsert(session("alice@example.com", "access-1", List.of()));
        store.close();

        assertFalse(connection.isClosed());
        assertEquals(Set.of(), store.find("alice@example.com").orElseThrow().getGroups());
    }

    @Test
    void closedStoreReportsStorageFailure() throws Exception {
        SqliteSessionStore standalone = new SqliteSessionStore("jdbc:sqlite::memory:");
        standalone.close();

        AuthException ex = assertThrows(AuthException.class, () -> standalone.find("alice@example.com"));
        assertEquals(AuthException.Kind.STORAGE_FAILURE, ex.getKind());
    }

    @Test
    void invalidUrlReportsStorageFailure() {
        AuthException ex = assertThrows(AuthException.class, () -> new SqliteSessionStore("jdbc:nosuchdriver:x"));
        assertEquals(AuthException.Kind.STORAGE_FAILURE, ex.getKind());
    }

    private int countRows(String table) throws Exception {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private static Session session(String identity, String accessToken, List<String> groups) {
        return new Session(identity, accessToken, "refresh-1", 1_700_000_000L, "Bearer",
            "https://graph.windows.net", "user_impersonation", groups);
    }
}
