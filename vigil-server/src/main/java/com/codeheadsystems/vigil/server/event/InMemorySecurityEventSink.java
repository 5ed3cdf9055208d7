package com.codeheadsystems.vigil.server.event;

import com.codeheadsystems.vigil.model.event.SecurityEventKind;
import com.codeheadsystems.vigil.model.event.SecurityEventRecord;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps events in memory. For tests and development.
 */
public class InMemorySecurityEventSink implements SecurityEventSink {

  private final CopyOnWriteArrayList<SecurityEventRecord> events = new CopyOnWriteArrayList<>();

  @Override
  public void record(SecurityEventRecord event) {
    events.add(event);
  }

  public List<SecurityEventRecord> events() {
    return List.copyOf(events);
  }

  public List<SecurityEventKind> kinds() {
    return events.stream().map(SecurityEventRecord::kind).toList();
  }

  public List<SecurityEventRecord> events(SecurityEventKind kind) {
    return events.stream().filter(e -> e.kind() == kind).toList();
  }

  public void clear() {
    events.clear();
  }
}
