package org.redlist.maps.reader;

import java.io.Closeable;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.redlist.maps.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A JDBC connection to a Natural Earth sqlite distribution, or a zip file containing one.
 *
 * @see <a href="https://www.naturalearthdata.com/">Natural Earth</a>
 */
public class NaturalEarthDatabase implements Closeable {

  private static final Pattern VALID_TABLE_NAME = Pattern.compile("ne_[a-z0-9_]+", Pattern.CASE_INSENSITIVE);
  private static final Pattern RESOLUTION = Pattern.compile("^ne_(\\d+)m_(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Logger LOGGER = LoggerFactory.getLogger(NaturalEarthDatabase.class);

  private final Connection conn;
  private final boolean keepUnzipped;
  private Path extracted;

  static {
    // make sure sqlite driver loaded
    try {
      Class.forName("org.sqlite.JDBC");
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("sqlite JDBC driver not found");
    }
  }

  /**
   * Opens the Natural Earth sqlite file at {@code input}.
   *
   * @param input        path to the sqlite or zip file
   * @param tmpDir       directory to extract the sqlite file into (if input is a zip file)
   * @param keepUnzipped to keep unzipped files around after closing (speeds up subsequent runs, but uses more disk)
   * @throws IllegalArgumentException if a problem occurs opening the input file
   */
  public NaturalEarthDatabase(Path input, Path tmpDir, boolean keepUnzipped) {
    this.keepUnzipped = keepUnzipped;
    if (!Files.isRegularFile(input)) {
      throw new IllegalArgumentException("Natural Earth file not found: " + input);
    }
    try {
      conn = open(input, tmpDir);
    } catch (IOException | SQLException e) {
      throw new IllegalArgumentException("Unable to open Natural Earth data from " + input, e);
    }
  }

  /** Returns a JDBC connection to the sqlite file. Input can be the sqlite file itself or a zip file containing it. */
  private Connection open(Path path, Path unzippedDir) throws IOException, SQLException {
    String uri = "jdbc:sqlite:" + path.toAbsolutePath();
    if (FileUtils.hasExtension(path, "zip")) {
      try (var zipFs = FileSystems.newFileSystem(path)) {
        var zipEntry = FileUtils.walkFileSystem(zipFs)
          .filter(Files::isRegularFile)
          .filter(entry -> FileUtils.hasExtension(entry, "sqlite"))
          .findFirst()
          .orElseThrow(() -> new IllegalArgumentException("No .sqlite file found inside " + path));
        extracted = unzippedDir.resolve(URLEncoder.encode(zipEntry.toString(), StandardCharsets.UTF_8));
        FileUtils.createParentDirectories(extracted);
        if (!keepUnzipped || FileUtils.isNewer(path, extracted)) {
          LOGGER.info("unzipping {} to {}", path.toAbsolutePath(), extracted);
          try (var in = Files.newInputStream(zipEntry)) {
            Files.copy(in, extracted, StandardCopyOption.REPLACE_EXISTING);
          }
        }
        if (!keepUnzipped) {
          extracted.toFile().deleteOnExit();
        }
      }
      uri = "jdbc:sqlite:" + extracted.toAbsolutePath();
    }
    return DriverManager.getConnection(uri);
  }

  Connection connection() {
    return conn;
  }

  /** Returns the names of all {@code ne_*} tables in the file. */
  public List<String> tableNames() throws SQLException {
    List<String> result = new ArrayList<>();
    try (ResultSet rs = conn.getMetaData().getTables(null, null, null, null)) {
      while (rs.next()) {
        String table = rs.getString("TABLE_NAME");
        if (VALID_TABLE_NAME.matcher(table).matches()) {
          result.add(table);
        }
      }
    }
    return result;
  }

  /**
   * Returns the most detailed table for a theme, for example {@code ne_10m_land} over {@code ne_110m_land} for
   * {@code "land"}.
   */
  public Optional<String> mostDetailedTable(String theme) throws SQLException {
    return tableNames().stream()
      .filter(table -> {
        Matcher matcher = RESOLUTION.matcher(table);
        return matcher.matches() && matcher.group(2).equalsIgnoreCase(theme);
      })
      .min(Comparator.comparingInt(NaturalEarthDatabase::resolution));
  }

  private static int resolution(String table) {
    Matcher matcher = RESOLUTION.matcher(table);
    return matcher.matches() ? Integer.parseInt(matcher.group(1)) : Integer.MAX_VALUE;
  }

  /** Returns the lower-case column names of {@code table}. */
  public Set<String> columns(String table) throws SQLException {
    Set<String> result = new HashSet<>();
    try (ResultSet rs = conn.getMetaData().getColumns(null, null, table, null)) {
      while (rs.next()) {
        result.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
      }
    }
    return result;
  }

  @Override
  public void close() {
    try {
      conn.close();
    } catch (SQLException e) {
      LOGGER.error("Error closing sqlite file", e);
    }
    if (!keepUnzipped && extracted != null) {
      FileUtils.deleteFile(extracted);
    }
  }
}
