package eventstore.jdbc;

import eventstore.jdbc.dialect.Dialects;
import eventstore.jdbc.spi.Dialect;

import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresEventStoreIntegrationTest extends AbstractJdbcEventStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("eventstore_test");

  @Override
  DataSource dataSource() {
    PGSimpleDataSource ds = new PGSimpleDataSource();
    ds.setUrl(postgres.getJdbcUrl());
    ds.setUser(postgres.getUsername());
    ds.setPassword(postgres.getPassword());
    return ds;
  }

  @Override
  Dialect dialect() {
    return Dialects.detect(postgres.getJdbcUrl());
  }
}
