package com.gentoro.ragmcp.query;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.ragmcp.ingestion.ResourceCategory;
import com.gentoro.ragmcp.store.SearchHit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContextFormatterTest {

  private static SearchHit hit(String content, String category) {
    return new SearchHit(content, category, "lib", "a.md", 0, 0.9);
  }

  @Test
  void rendersOneInnerListPerCategoryWithHits() {
    Map<ResourceCategory, List<SearchHit>> hits = new LinkedHashMap<>();
    hits.put(ResourceCategory.EXAMPLE, List.of(hit("{\"a\":1}", "example")));
    hits.put(
        ResourceCategory.DOCUMENT, List.of(hit("first", "document"), hit("second", "document")));

    assertEquals(
        "[[{\"kind\":\"example\",\"content\":[\"{\\\"a\\\":1}\"]}],"
            + "[{\"kind\":\"document\",\"content\":[\"first\",\"second\"]}]]",
        ContextFormatter.toJson(new QueryResult(hits)));
  }

  @Test
  void skipsCategoriesWithoutHits() {
    Map<ResourceCategory, List<SearchHit>> hits = new LinkedHashMap<>();
    hits.put(ResourceCategory.DOCUMENT, List.of());
    hits.put(ResourceCategory.EXAMPLE, List.of(hit("x", "example")));

    assertEquals(
        "[[{\"kind\":\"example\",\"content\":[\"x\"]}]]",
        ContextFormatter.toJson(new QueryResult(hits)));
  }
}
