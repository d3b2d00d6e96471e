package eventstore.jdbc;

import eventstore.jdbc.dialect.H2Dialect;
import eventstore.jdbc.spi.Dialect;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

class H2EventStoreIntegrationTest extends AbstractJdbcEventStoreIntegrationTest {
  // One database per test instance
  private final JdbcDataSource dataSource = new JdbcDataSource();

  H2EventStoreIntegrationTest() {
    dataSource.setURL("jdbc:h2:mem:events_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  Dialect dialect() {
    return new H2Dialect();
  }
}
