package com.gnovoa.fantasy.rosters;

import com.gnovoa.fantasy.model.Formation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The formations a fantasy line-up may use.
 *
 * <p>Each entry is parsed from its "D-M-F" identifier when the catalog is built, so an invalid
 * entry fails fast instead of surfacing at scoring time.
 */
public final class StandardFormationCatalog implements FormationCatalog {

  public static final List<String> SUPPORTED =
      List.of("3-4-3", "4-3-3", "3-5-2", "4-4-2", "5-3-2", "4-5-1", "5-4-1");

  /** Formations keyed by identifier, in declaration order. */
  private final Map<String, Formation> formations;

  public StandardFormationCatalog() {
    this(SUPPORTED);
  }

  /**
   * Builds a catalog from formation identifiers.
   *
   * @param ids identifiers in "D-M-F" form
   * @throws IllegalArgumentException if an identifier is malformed or repeated
   */
  public StandardFormationCatalog(List<String> ids) {
    Map<String, Formation> map = new LinkedHashMap<>();
    for (String id : ids) {
      if (map.put(id, Formation.parse(id)) != null) {
        throw new IllegalArgumentException("Duplicate formation " + id);
      }
    }
    this.formations = Collections.unmodifiableMap(map);
  }

  @Override
  public Optional<Formation> find(String id) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(formations.get(id.trim()));
  }

  @Override
  public List<Formation> all() {
    return List.copyOf(formations.values());
  }
}
