package eventstore.jdbc;

import eventstore.jdbc.dialect.H2Dialect;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaInitializerTest {

  @Test
  void scriptsSplitIntoStatements() {
    List<String> h2 = SchemaInitializer.loadStatements("eventstore/schema/h2.sql");
    List<String> pg = SchemaInitializer.loadStatements("eventstore/schema/postgresql.sql");

    assertEquals(5, h2.size());
    assertEquals(5, pg.size());
    assertTrue(h2.stream().allMatch(s -> s.startsWith("CREATE TABLE IF NOT EXISTS")));
    assertTrue(pg.stream().noneMatch(s -> s.endsWith(";")));
  }

  @Test
  void missingScriptFails() {
    assertThrows(StorageException.class, () -> SchemaInitializer.loadStatements("eventstore/schema/none.sql"));
  }

  @Test
  void initializeIsIdempotent() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:schema_init;DB_CLOSE_DELAY=-1");
    SchemaInitializer schema = new SchemaInitializer(new DataSourceConnectionProvider(ds), new H2Dialect());

    schema.initialize();
    schema.initialize();

    try (Connection conn = ds.getConnection();
         ResultSet rs = conn.createStatement().executeQuery("SELECT COUNT(*), MAX(last_position) FROM log_head")) {
      assertTrue(rs.next());
      assertEquals(1, rs.getInt(1));
      assertEquals(0, rs.getLong(2));
    }
  }
}
