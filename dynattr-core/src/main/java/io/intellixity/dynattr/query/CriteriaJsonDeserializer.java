package io.intellixity.dynattr.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON form of {@link Criteria}.
 * <p>
 * Either {@code {"logic": "OR", "filters": {...}}} or a bare filter map. Filter map entries keep
 * their document order.
 */
public final class CriteriaJsonDeserializer extends JsonDeserializer<Criteria> {
  @Override
  public Criteria deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException("Criteria JSON must be an object");

    JsonNode filters = root.get("filters");
    boolean wrapped = filters != null && (root.has("logic") || root.size() == 1);
    SearchLogic logic = wrapped ? SearchLogic.parse(textOrNull(root.get("logic"))) : SearchLogic.AND;
    JsonNode body = wrapped ? filters : root;
    if (!body.isObject()) throw new QueryValidationException("filters must be an object");

    List<Criterion> out = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = body.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      Object condition = codec.treeToValue(e.getValue(), Object.class);
      out.add(Criterion.fromEntry(e.getKey(), condition));
    }
    return new Criteria(out, logic);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
