package io.github.themoah.regdetect.metrics;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MicrometerConfig.
 */
public class MicrometerConfigTest {

  @Test
  void createRegistry_knownTypes() {
    assertInstanceOf(PrometheusMeterRegistry.class, MicrometerConfig.createRegistry("prometheus"));
    assertInstanceOf(PrometheusMeterRegistry.class, MicrometerConfig.createRegistry("Prometheus"));
    assertInstanceOf(SimpleMeterRegistry.class, MicrometerConfig.createRegistry("simple"));
  }

  @Test
  void createRegistry_unknownType_returnsNull() {
    assertNull(MicrometerConfig.createRegistry("datadog"));
    assertNull(MicrometerConfig.createRegistry(null));
  }

  @Test
  void bindJvmMetrics_registersJvmMeters() {
    MeterRegistry registry = new SimpleMeterRegistry();
    assertTrue(registry.find("jvm.memory.used").gauges().isEmpty());

    MicrometerConfig.bindJvmMetrics(registry);

    assertFalse(registry.find("jvm.memory.used").gauges().isEmpty());
  }

  @Test
  void prometheusScrape_includesReporterMetrics() {
    PrometheusMeterRegistry registry = MicrometerConfig.createPrometheusRegistry();
    new MicrometerReporter(registry).reportSeriesFailed("a/b");

    String scrape = registry.scrape();

    assertTrue(scrape.contains("regdetect_series_failed_total{test_path=\"a/b\"} 1.0"), scrape);
  }
}
