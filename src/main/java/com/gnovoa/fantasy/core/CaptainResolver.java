package com.gnovoa.fantasy.core;

import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.sim.RandomSource;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the match captain from a roster.
 *
 * <p>The first flagged player wins. Without a flag a random starter is picked and a warning is
 * logged; repeated calls may then disagree unless the {@link RandomSource} is seeded.
 */
public final class CaptainResolver {

  private static final Logger log = LoggerFactory.getLogger(CaptainResolver.class);

  private final RandomSource rnd;

  public CaptainResolver(RandomSource rnd) {
    this.rnd = rnd;
  }

  /**
   * @param roster starting players in roster order
   * @return captain id, or null for an empty roster
   */
  public String resolve(List<Player> roster) {
    for (Player p : roster) {
      if (p.captain()) return p.id();
    }
    if (roster.isEmpty()) return null;
    log.warn("Captain not provided, picking a random one");
    return roster.get(rnd.nextIntInclusive(0, roster.size() - 1)).id();
  }
}
