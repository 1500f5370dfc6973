package io.github.themoah.regdetect.alerting;

import io.github.themoah.regdetect.changepoint.AnomalyConfig;
import io.github.themoah.regdetect.model.DataPoint;
import io.github.themoah.regdetect.model.ImprovementDirection;
import io.github.themoah.regdetect.model.MonitoredSeries;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads series files of the form:
 * <pre>
 * {
 *   "testPath": "ChromiumPerf/linux/speedometer/Total",
 *   "improvementDirection": "up",
 *   "refTestPath": "ChromiumPerf/linux/speedometer/Total_ref",
 *   "monitored": true,
 *   "anomalyConfig": {"min_segment_size": 6, "multiple_of_std_dev": 3.5},
 *   "points": [[1000, 10.5], [1001, 10.7]]
 * }
 * </pre>
 * {@code refTestPath}, {@code monitored} (default true) and {@code anomalyConfig}
 * are optional. Points are sorted by revision.
 */
public class JsonSeriesCodec {

  /**
   * A decoded series file.
   */
  public record SeriesFile(MonitoredSeries series, List<DataPoint> points) {}

  private final AnomalyConfig defaultConfig;

  /**
   * @param defaultConfig thresholds that a file's {@code anomalyConfig} overrides
   */
  public JsonSeriesCodec(AnomalyConfig defaultConfig) {
    this.defaultConfig = defaultConfig;
  }

  /**
   * @throws IllegalArgumentException if a required field is missing or a point is malformed
   * @throws io.github.themoah.regdetect.changepoint.InvalidConfigException if the config is invalid
   */
  public SeriesFile decode(JsonObject json) {
    String testPath = json.getString("testPath");
    if (testPath == null || testPath.isBlank()) {
      throw new IllegalArgumentException("Series file is missing 'testPath'");
    }
    ImprovementDirection direction = ImprovementDirection.fromString(json.getString("improvementDirection"));
    JsonObject configJson = json.getJsonObject("anomalyConfig", new JsonObject());
    AnomalyConfig config = defaultConfig.withOverrides(configJson.getMap()).validate();

    MonitoredSeries series = new MonitoredSeries(
      testPath,
      direction,
      json.getString("refTestPath"),
      config,
      json.getBoolean("monitored", true)
    );
    return new SeriesFile(series, decodePoints(testPath, json.getJsonArray("points", new JsonArray())));
  }

  public SeriesFile decode(String text) {
    return decode(new JsonObject(text));
  }

  private static List<DataPoint> decodePoints(String testPath, JsonArray array) {
    List<DataPoint> points = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      JsonArray pair = array.getJsonArray(i);
      if (pair == null || pair.size() != 2) {
        throw new IllegalArgumentException(
          "Point " + i + " of " + testPath + " must be a [revision, value] pair");
      }
      points.add(new DataPoint(pair.getLong(0), pair.getDouble(1)));
    }
    points.sort(Comparator.comparingLong(DataPoint::revision));
    return points;
  }
}
