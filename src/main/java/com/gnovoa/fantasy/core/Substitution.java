package com.gnovoa.fantasy.core;

import com.gnovoa.fantasy.model.Player;

/** A starter who did not score replaced by a bench player of the same position. */
public record Substitution(Player out, Player in) {}
