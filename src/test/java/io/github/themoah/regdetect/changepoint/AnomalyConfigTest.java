package io.github.themoah.regdetect.changepoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AnomalyConfig.
 */
public class AnomalyConfigTest {

  @Test
  void defaults_haveDocumentedValues() {
    AnomalyConfig config = AnomalyConfig.defaults();

    assertEquals(0, config.maxWindowSize());
    assertEquals(6, config.minSegmentSize());
    assertEquals(0, config.maxSegmentSize());
    assertEquals(12, config.effectiveMaxSegmentSize());
    assertEquals(2.5, config.multipleOfStdDev());
    assertEquals(0.01, config.minRelativeChange());
    assertEquals(0.0, config.minAbsoluteChange());
    assertEquals(0.0, config.minSteppiness(), "Steppiness is only checked when configured");
  }

  @Test
  void fromMap_appliesRecognizedKeys_andIgnoresUnknownOnes() {
    Map<String, Object> values = new HashMap<>();
    values.put("min_segment_size", 4);
    values.put("multiple_of_std_dev", 3.5);
    values.put("min_absolute_change", "1.5");
    values.put("sheriff", "perf-team");

    AnomalyConfig config = AnomalyConfig.fromMap(values);

    assertEquals(4, config.minSegmentSize());
    assertEquals(3.5, config.multipleOfStdDev());
    assertEquals(1.5, config.minAbsoluteChange());
    assertEquals(0.01, config.minRelativeChange(), "Missing keys keep their defaults");
  }

  @Test
  void withOverrides_keepsUnsetValuesOfTheBase() {
    AnomalyConfig base = AnomalyConfig.defaults().withOverrides(Map.of("max_window_size", 30));

    AnomalyConfig config = base.withOverrides(Map.of("min_relative_change", 0.2));

    assertEquals(30, config.maxWindowSize());
    assertEquals(0.2, config.minRelativeChange());
  }

  @Test
  void withOverrides_emptyMap_returnsSameInstance() {
    AnomalyConfig base = AnomalyConfig.defaults();

    assertSame(base, base.withOverrides(Map.of()));
  }

  @Test
  void withOverrides_wronglyTypedValue_throws() {
    AnomalyConfig base = AnomalyConfig.defaults();

    assertThrows(InvalidConfigException.class, () -> base.withOverrides(Map.of("min_segment_size", "six")));
    assertThrows(InvalidConfigException.class, () -> base.withOverrides(Map.of("min_segment_size", 2.5)));
    assertThrows(InvalidConfigException.class, () -> base.withOverrides(Map.of("min_steppiness", true)));
  }

  @Test
  void validate_rejectsOutOfRangeValues() {
    assertThrows(InvalidConfigException.class,
      () -> AnomalyConfig.fromMap(Map.of("min_segment_size", 0)).validate());
    assertThrows(InvalidConfigException.class,
      () -> AnomalyConfig.fromMap(Map.of("multiple_of_std_dev", -1)).validate());
    assertThrows(InvalidConfigException.class,
      () -> AnomalyConfig.fromMap(Map.of("min_absolute_change", -0.5)).validate());
    assertThrows(InvalidConfigException.class,
      () -> AnomalyConfig.fromMap(Map.of("max_window_size", -3)).validate());
    assertThrows(InvalidConfigException.class,
      () -> AnomalyConfig.fromMap(Map.of("min_segment_size", 6, "max_segment_size", 4)).validate());
  }

  @Test
  void effectiveMaxSegmentSize_usesExplicitValue() {
    AnomalyConfig config = AnomalyConfig.fromMap(Map.of("min_segment_size", 5, "max_segment_size", 20));

    assertEquals(20, config.effectiveMaxSegmentSize());
  }
}
