package com.gnovoa.fantasy.api.dto;

public record GoalsResponse(double points, int goals, double threshold, double gap) {}
