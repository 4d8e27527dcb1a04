package io.intellixity.dynattr.spi.exec;

/** A write collided with an existing row on a unique key. */
public class DuplicateKeyException extends StorageEngineException {
  public DuplicateKeyException(String message) {
    super(message);
  }

  public DuplicateKeyException(String message, Throwable cause) {
    super(message, cause);
  }
}
