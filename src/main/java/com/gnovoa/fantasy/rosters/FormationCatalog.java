package com.gnovoa.fantasy.rosters;

import com.gnovoa.fantasy.model.Formation;
import java.util.List;
import java.util.Optional;

/** Lookup of supported formations by identifier. */
public interface FormationCatalog {

  Optional<Formation> find(String id);

  List<Formation> all();

  /**
   * Returns the formation for the given identifier.
   *
   * @throws UnsupportedFormationException if the identifier is unknown
   */
  default Formation require(String id) {
    return find(id).orElseThrow(() -> new UnsupportedFormationException(id));
  }
}
