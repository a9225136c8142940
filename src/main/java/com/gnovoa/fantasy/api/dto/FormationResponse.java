package com.gnovoa.fantasy.api.dto;

import com.gnovoa.fantasy.model.Formation;

public record FormationResponse(
    String id, int goalkeepers, int defenders, int midfielders, int forwards) {

  public static FormationResponse from(Formation f) {
    return new FormationResponse(
        f.id(), f.goalkeepers(), f.defenders(), f.midfielders(), f.forwards());
  }
}
