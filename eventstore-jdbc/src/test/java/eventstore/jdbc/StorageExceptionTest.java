package eventstore.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

import static org.junit.jupiter.api.Assertions.*;

class StorageExceptionTest {

  @Test
  void integrityViolationIsDetectedBySqlState() {
    assertTrue(new StorageException("dup", new SQLException("dup", "23505")).isIntegrityViolation());
    assertTrue(new StorageException("dup",
        new RuntimeException(new SQLIntegrityConstraintViolationException("dup", "23000"))).isIntegrityViolation());
    assertFalse(new StorageException("timeout", new SQLException("timeout", "08001")).isIntegrityViolation());
    assertFalse(new StorageException("no cause").isIntegrityViolation());
  }
}
