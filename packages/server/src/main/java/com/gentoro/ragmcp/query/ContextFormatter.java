package com.gentoro.ragmcp.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.ragmcp.exception.SerializationException;
import com.gentoro.ragmcp.ingestion.ResourceCategory;
import com.gentoro.ragmcp.store.SearchHit;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link QueryResult} as the context payload read by the agent:
 *
 * <pre>
 * [[{"kind":"document","content":["...","..."]}],[{"kind":"example","content":["..."]}]]
 * </pre>
 *
 * One inner list per category that produced hits, contents in rank order.
 */
public final class ContextFormatter {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ContextFormatter() {}

  public static String toJson(QueryResult result) {
    ArrayNode root = MAPPER.createArrayNode();
    for (Map.Entry<ResourceCategory, List<SearchHit>> e : result.hitsByCategory().entrySet()) {
      if (e.getValue().isEmpty()) continue;
      ObjectNode entry = MAPPER.createObjectNode();
      entry.put("kind", e.getKey().label());
      ArrayNode content = entry.putArray("content");
      for (SearchHit hit : e.getValue()) {
        content.add(hit.content());
      }
      root.addArray().add(entry);
    }
    try {
      return MAPPER.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to render query context", e);
    }
  }
}
