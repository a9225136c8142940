package com.gnovoa.fantasy.api.dto;

import java.util.List;

public record ScoreRequest(
    String formation,
    List<PlayerEntry> roster,
    List<PlayerEntry> bench,
    List<PlayerEntry> fixture,
    boolean away) {}
