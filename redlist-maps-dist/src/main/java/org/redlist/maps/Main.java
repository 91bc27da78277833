package org.redlist.maps;

import static java.util.Map.entry;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.redlist.maps.assessment.EooResult;
import org.redlist.maps.assessment.ExtentOfOccurrence;
import org.redlist.maps.compute.AuthCheck;
import org.redlist.maps.compute.EarthEngineClient;
import org.redlist.maps.compute.Image;
import org.redlist.maps.config.Arguments;
import org.redlist.maps.config.MapsConfig;
import org.redlist.maps.reader.BoundaryResolver;
import org.redlist.maps.reader.NaturalEarthBoundaryStore;
import org.redlist.maps.reader.ResolvedBoundary;
import org.redlist.maps.render.RenderedMap;
import org.redlist.maps.util.BuildInfo;

/**
 * Main entry-point for the executable jar, which dispatches on the first argument to a task.
 */
public class Main {

  private static final Map<String, EntryPoint> ENTRY_POINTS = Map.ofEntries(
    entry("render", Main::render),
    entry("test-auth", Main::testAuth),
    entry("eoo", Main::eoo),
    entry("--version", args -> version()),
    entry("-v", args -> version())
  );

  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      greet(System.out);
      return;
    }
    String maybeTask = args[0].trim().toLowerCase(Locale.ROOT);
    EntryPoint task = ENTRY_POINTS.get(maybeTask);
    if (task == null) {
      System.err.println("Unrecognized task: " + maybeTask);
      System.err.println("possibilities: " + ENTRY_POINTS.keySet());
      System.exit(1);
    }
    task.main(Arrays.copyOfRange(args, 1, args.length));
  }

  private static void greet(PrintStream out) {
    out.println("Hello from redlist-maps!");
    out.println("usage: render <code> [output] [--key=value ...] | test-auth | eoo --image=<asset> --region=<code>");
  }

  private static void version() {
    BuildInfo info = BuildInfo.get();
    System.out.println("redlist-maps " + (info.version() == null ? "unknown" : info.version()) +
      (info.buildTime() == null ? "" : " built " + info.buildTimeString()));
  }

  /** {@code render <code> [output] [--key=value ...]} */
  private static void render(String[] args) throws Exception {
    List<String> positional = new ArrayList<>();
    List<String> options = new ArrayList<>();
    for (String arg : args) {
      (arg.startsWith("-") || arg.contains("=") ? options : positional).add(arg);
    }
    if (positional.isEmpty()) {
      System.err.println("usage: render <code> [output] [--key=value ...]");
      System.exit(1);
    }
    Arguments arguments = Arguments.fromArgsOrConfigFile(options.toArray(String[]::new));
    if (positional.size() > 1) {
      arguments = Arguments.of("output", positional.get(1)).orElse(arguments);
    }
    MapsConfig config = MapsConfig.from(arguments);
    RenderRequest request = RenderRequest.fromArguments(positional.get(0), arguments);
    try (CountryMaps maps = CountryMaps.create(config)) {
      RenderedMap map = maps.render(request);
      System.out.println(map.outputPath().toAbsolutePath());
    }
  }

  /** {@code test-auth}: prints the status and exits normally whether or not authentication succeeded. */
  private static void testAuth(String[] args) {
    MapsConfig config = MapsConfig.from(Arguments.fromArgsOrConfigFile(args));
    AuthCheck.printStatus(EarthEngineClient.create(config), System.out);
  }

  /** {@code eoo --image=<asset> --region=<code>} */
  private static void eoo(String[] args) throws Exception {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    MapsConfig config = MapsConfig.from(arguments);
    String image = arguments.getString("image", "binary class image asset id", null);
    String region = arguments.getString("region", "2-letter code of the region to reduce over", null);
    double maxError = arguments.getDouble("max_error", "convex hull error margin in meters",
      ExtentOfOccurrence.DEFAULT_MAX_ERROR);
    boolean bestEffort = arguments.getBoolean("best_effort", "let the service coarsen the reduction", true);
    Path naturalEarth = config.naturalEarth();
    if (image == null || region == null || naturalEarth == null) {
      System.err.println("usage: eoo --image=<asset> --region=<code> --natural_earth=<sqlite or zip>");
      System.exit(1);
    }
    try (var store = NaturalEarthBoundaryStore.open(naturalEarth, config.tmpDir(), config.keepUnzippedSources())) {
      ResolvedBoundary boundary = new BoundaryResolver(store).resolve(region);
      EooResult result = ExtentOfOccurrence.evaluate(EarthEngineClient.create(config), Image.load(image),
        boundary.lonLatGeometry(), maxError, bestEffort);
      System.out.printf(Locale.ROOT, "EOO area: %.2f km2%n", result.areaKm2());
    }
  }

  @FunctionalInterface
  private interface EntryPoint {

    void main(String[] args) throws Exception;
  }
}
