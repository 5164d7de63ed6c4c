package com.flamingo.ai.researchcache.service.index;

import com.flamingo.ai.researchcache.domain.model.LibraryItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Formats the {@code creators} list of an item's remote metadata as an author line. */
final class CreatorNames {

  static final String UNKNOWN = "Unknown";

  private CreatorNames() {}

  static String format(LibraryItem item) {
    if (!(item.metadata().get("creators") instanceof List<?> creators)) {
      return UNKNOWN;
    }
    List<String> names = new ArrayList<>();
    for (Object creator : creators) {
      if (!(creator instanceof Map<?, ?> fields)) {
        continue;
      }
      Object last = fields.get("lastName");
      Object first = fields.get("firstName");
      Object single = fields.get("name");
      if (last != null) {
        names.add(first != null ? first + " " + last : last.toString());
      } else if (single != null) {
        names.add(single.toString());
      }
    }
    return names.isEmpty() ? UNKNOWN : String.join(", ", names);
  }
}
