package org.redlist.maps.reader;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.redlist.maps.util.LogUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link BoundaryStore} that reads country polygons from the {@code ne_*_admin_0_countries} table of a Natural Earth
 * sqlite distribution.
 * <p>
 * Countries are keyed by the {@code iso_a2} column. Natural Earth uses {@code -99} for a handful of countries (France
 * and Norway among them), for those the {@code iso_a2_eh} column is used instead.
 */
public class NaturalEarthBoundaryStore implements BoundaryStore {

  static final String COUNTRIES_THEME = "admin_0_countries";
  private static final String MISSING_CODE = "-99";
  private static final Logger LOGGER = LoggerFactory.getLogger(NaturalEarthBoundaryStore.class);

  private final NaturalEarthDatabase database;
  private final boolean ownsDatabase;
  private Map<String, byte[]> boundaries;

  /** Wraps an already open database, which the caller remains responsible for closing. */
  public NaturalEarthBoundaryStore(NaturalEarthDatabase database) {
    this(database, false);
  }

  private NaturalEarthBoundaryStore(NaturalEarthDatabase database, boolean ownsDatabase) {
    this.database = database;
    this.ownsDatabase = ownsDatabase;
  }

  /**
   * Opens a store over the Natural Earth sqlite (or zip) file at {@code path}.
   *
   * @throws IllegalArgumentException if the file cannot be opened
   */
  public static NaturalEarthBoundaryStore open(Path path, Path tmpDir, boolean keepUnzipped) {
    return new NaturalEarthBoundaryStore(new NaturalEarthDatabase(path, tmpDir, keepUnzipped), true);
  }

  private synchronized Map<String, byte[]> boundaries() {
    if (boundaries == null) {
      try {
        boundaries = load();
      } catch (SQLException e) {
        throw new IllegalStateException("Unable to read country boundaries from Natural Earth", e);
      }
    }
    return boundaries;
  }

  private Map<String, byte[]> load() throws SQLException {
    try (var ignored = LogUtil.enterSubStage("boundaries")) {
      String table = database.mostDetailedTable(COUNTRIES_THEME)
        .orElseThrow(() -> new IllegalStateException("No ne_*_admin_0_countries table found"));
      Set<String> columns = database.columns(table);
      boolean hasFallback = columns.contains("iso_a2_eh");
      Map<String, byte[]> result = new TreeMap<>();
      try (
        Statement statement = database.connection().createStatement();
        @SuppressWarnings("java:S2077") // table name checked against a regex
        ResultSet rs = statement.executeQuery("SELECT iso_a2, %s GEOMETRY FROM %s WHERE GEOMETRY IS NOT NULL;"
          .formatted(hasFallback ? "iso_a2_eh," : "", table))
      ) {
        while (rs.next()) {
          String code = rs.getString("iso_a2");
          if ((code == null || MISSING_CODE.equals(code)) && hasFallback) {
            code = rs.getString("iso_a2_eh");
          }
          if (code == null || MISSING_CODE.equals(code)) {
            continue;
          }
          byte[] geometry = rs.getBytes("GEOMETRY");
          if (result.putIfAbsent(code.toLowerCase(Locale.ROOT), geometry) != null) {
            LOGGER.debug("Ignoring duplicate boundary for {} in {}", code, table);
          }
        }
      }
      LOGGER.info("Loaded {} country boundaries from {}", result.size(), table);
      return result;
    }
  }

  @Override
  public byte[] wkb(String lowerCaseCode) throws NotFoundException {
    byte[] result = boundaries().get(lowerCaseCode);
    if (result == null) {
      throw new NotFoundException(lowerCaseCode);
    }
    return result.clone();
  }

  @Override
  public Set<String> codes() {
    return Set.copyOf(boundaries().keySet());
  }

  @Override
  public void close() {
    if (ownsDatabase) {
      database.close();
    }
  }
}
