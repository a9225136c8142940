package com.gnovoa.fantasy.api.dto;

import java.util.List;

public record ScoreResponse(
    String formation,
    double total,
    int goals,
    boolean away,
    String captainId,
    String finalCaptainId,
    List<SubstitutionItem> substitutions,
    List<PlayerEntry> lineup) {
  public record SubstitutionItem(String outId, String inId, String position) {}
}
