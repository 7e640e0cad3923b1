package com.school.kanban.realtime.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// Builds event data maps from key/value pairs, skipping null values.
public final class EventData {

  private EventData() {}

  public static Map<String, Object> of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("expected key/value pairs, got " + keysAndValues.length + " arguments");
    }
    Map<String, Object> data = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      Object value = keysAndValues[i + 1];
      if (value != null) data.put((String) keysAndValues[i], value);
    }
    return Collections.unmodifiableMap(data);
  }
}
