package com.gnovoa.fantasy.sim;

/** Source of randomness, injectable so picks can be reproduced in tests. */
public interface RandomSource {
  int nextIntInclusive(int fromInclusive, int toInclusive);
}
