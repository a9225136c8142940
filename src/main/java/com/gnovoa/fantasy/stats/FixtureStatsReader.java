package com.gnovoa.fantasy.stats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.gnovoa.fantasy.model.Player;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a fixture's player statistics from JSON Lines, one {@link Player} object per line.
 *
 * <p>Blank lines are skipped. Field names from the statistics export ({@code _id},
 * {@code position_name}) are accepted next to the record's own names.
 */
public final class FixtureStatsReader {

  private final ObjectReader reader;

  public FixtureStatsReader(ObjectMapper mapper) {
    this.reader = mapper.readerFor(Player.class);
  }

  /**
   * @param path JSON Lines file
   * @return players in file order
   * @throws IllegalStateException if the file cannot be read or a line cannot be parsed
   */
  public List<Player> read(Path path) {
    Path p = path.toAbsolutePath().normalize();
    try (var in = Files.newInputStream(p)) {
      return read(in, p.toString());
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load fixture statistics from " + p, e);
    }
  }

  /**
   * @param in JSON Lines stream, not closed by this method
   * @param source name used only for error reporting
   */
  public List<Player> read(InputStream in, String source) {
    List<Player> players = new ArrayList<>();
    var lines = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    int lineNo = 0;
    try {
      String line;
      while ((line = lines.readLine()) != null) {
        lineNo++;
        if (line.isBlank()) continue;
        players.add(reader.readValue(line));
      }
    } catch (Exception e) {
      throw new IllegalStateException(
          "Invalid fixture statistics at " + source + ":" + lineNo, e);
    }
    return players;
  }
}
