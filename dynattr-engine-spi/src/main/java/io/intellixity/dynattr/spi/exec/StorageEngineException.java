package io.intellixity.dynattr.spi.exec;

/** Backend failure reported by a {@link StorageEngine}. */
public class StorageEngineException extends RuntimeException {
  public StorageEngineException(String message) {
    super(message);
  }

  public StorageEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
