package com.gnovoa.fantasy.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.Position;

/** Player as sent by API clients; points are ignored on roster and bench entries. */
public record PlayerEntry(
    @JsonAlias("_id") String id,
    String name,
    @JsonAlias("position_name") Position position,
    Double points,
    Boolean captain) {

  public Player toPlayer() {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Player id is required");
    if (position == null) throw new IllegalArgumentException("Player " + id + " has no position");
    return new Player(
        id,
        name == null ? id : name,
        position,
        points == null ? 0.0 : points,
        Boolean.TRUE.equals(captain));
  }

  public static PlayerEntry from(Player p) {
    return new PlayerEntry(p.id(), p.name(), p.position(), p.points(), p.captain());
  }
}
