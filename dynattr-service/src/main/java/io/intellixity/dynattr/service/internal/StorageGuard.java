package io.intellixity.dynattr.service.internal;

import io.intellixity.dynattr.error.AttributeException;
import io.intellixity.dynattr.error.StorageException;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.query.QueryValidationException;
import org.slf4j.Logger;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs storage work and turns unexpected failures into a logged, sanitized {@link StorageException}.
 * Domain errors pass through untouched.
 */
public final class StorageGuard {
  private StorageGuard() {}

  public static <T> T run(Logger log, String operation, EntityRef entity, List<String> attributes, Supplier<T> work) {
    try {
      return work.get();
    } catch (AttributeException | QueryValidationException | IllegalArgumentException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("dynattr op={} entityType={} entityId={} attributes={} error={}",
          operation,
          entity == null ? null : entity.type(),
          entity == null ? null : entity.id(),
          attributes,
          e.toString(),
          e);
      throw new StorageException(operation, entity, attributes, e);
    }
  }
}
