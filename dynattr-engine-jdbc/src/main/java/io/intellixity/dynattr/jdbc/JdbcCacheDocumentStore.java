package io.intellixity.dynattr.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.spi.cache.CacheDocumentStore;
import io.intellixity.dynattr.spi.exec.StorageEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Cache documents kept as JSON in a column of each host table.\n
 *
 * Dates are written as ISO strings and read back as strings. Reads and writes run on the owning
 * engine's current transaction.
 */
final class JdbcCacheDocumentStore implements CacheDocumentStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcCacheDocumentStore.class);
  private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT = new TypeReference<>() {};

  private final JdbcStorageEngine engine;
  private final Map<String, HostTable> hosts = new HashMap<>();
  private final ObjectMapper mapper = newMapper();

  JdbcCacheDocumentStore(JdbcStorageEngine engine, Collection<HostTable> hostTables) {
    this.engine = Objects.requireNonNull(engine, "engine");
    if (hostTables != null) {
      for (HostTable h : hostTables) hosts.put(h.entityType(), h);
    }
  }

  static ObjectMapper newMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  public boolean carriesCache(String entityType) {
    return hosts.containsKey(entityType);
  }

  @Override
  public Optional<Map<String, Object>> read(EntityRef entity) {
    HostTable host = hosts.get(entity.type());
    if (host == null || !entity.persisted()) return Optional.empty();
    SqlStatement ss = engine.dialect().selectCacheDocument(host, entity.id());
    List<String> rows = engine.query(engine.currentTx(), "READ_DOCUMENT", ss, rs -> rs.getString(1));
    if (rows.isEmpty() || rows.get(0) == null) return Optional.empty();
    try {
      return Optional.of(mapper.readValue(rows.get(0), DOCUMENT));
    } catch (JsonProcessingException e) {
      log.warn("dynattr.cache unreadable document entityType={} entityId={} table={} column={} error={}"
              + "; resync the entity type to rebuild it",
          entity.type(), entity.id(), host.table(), host.cacheColumn(), e.getOriginalMessage());
      return Optional.empty();
    }
  }

  @Override
  public void write(EntityRef entity, Map<String, Object> document) {
    HostTable host = hosts.get(entity.type());
    if (host == null || !entity.persisted()) return;
    String json;
    try {
      json = mapper.writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new StorageEngineException("Failed to encode cache document of " + entity, e);
    }
    SqlStatement ss = engine.dialect().updateCacheDocument(host, entity.id(), json);
    long n = engine.inTx(() -> engine.update(engine.currentTx(), "WRITE_DOCUMENT", ss));
    if (n == 0) log.debug("dynattr.cache no host row entity={} table={}", entity, host.table());
  }
}
