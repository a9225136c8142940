package com.gnovoa.fantasy.rosters;

/** The requested formation identifier is not in the catalog. */
public final class UnsupportedFormationException extends LineupException {

  private final String formationId;

  public UnsupportedFormationException(String formationId) {
    super("Unsupported formation " + formationId);
    this.formationId = formationId;
  }

  public String formationId() {
    return formationId;
  }
}
