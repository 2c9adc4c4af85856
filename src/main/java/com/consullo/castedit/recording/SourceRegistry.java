package com.consullo.castedit.recording;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Id-keyed collection of loaded recordings, in load order.
 *
 * <p>A recording whose name and duration match an already registered one is not registered twice; the
 * existing entry is returned instead. Recordings are immutable, so the registry hands them out directly.</p>
 *
 * @since 1.0
 */
public final class SourceRegistry {

  private final Map<String, Recording> byId = new LinkedHashMap<>();

  /**
   * Registers a recording unless an equivalent one is present.
   *
   * @param recording recording to add
   * @return the registered recording (the given one, or the existing duplicate)
   */
  public Recording register(Recording recording) {
    Validate.notNull(recording, "recording must not be null");
    String key = dedupKey(recording);
    for (Recording existing : byId.values()) {
      if (dedupKey(existing).equals(key)) {
        return existing;
      }
    }
    byId.put(recording.id(), recording);
    return recording;
  }

  public Optional<Recording> find(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byId.get(id));
  }

  /**
   * Returns the recording with the given id.
   *
   * @param id source id
   * @return recording
   * @throws IllegalArgumentException if no recording has this id
   */
  public Recording require(String id) {
    Recording r = byId.get(id);
    if (r == null) {
      throw new IllegalArgumentException("Unknown source id: " + id);
    }
    return r;
  }

  public boolean contains(String id) {
    return byId.containsKey(id);
  }

  /**
   * Returns the first registered recording, the one whose header an export carries.
   *
   * @return first recording, if any
   */
  public Optional<Recording> first() {
    return byId.values().stream().findFirst();
  }

  public List<Recording> all() {
    return Collections.unmodifiableList(new ArrayList<>(byId.values()));
  }

  public int size() {
    return byId.size();
  }

  public boolean isEmpty() {
    return byId.isEmpty();
  }

  public void clear() {
    byId.clear();
  }

  private static String dedupKey(Recording r) {
    return r.name() + ":" + String.format(Locale.ROOT, "%.6f", r.duration());
  }
}
