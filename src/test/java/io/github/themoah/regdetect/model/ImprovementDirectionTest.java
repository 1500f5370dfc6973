package io.github.themoah.regdetect.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for ImprovementDirection.
 */
public class ImprovementDirectionTest {

  @Test
  void fromString_parsesKnownValues_andDefaultsToUnknown() {
    assertEquals(ImprovementDirection.UP, ImprovementDirection.fromString("up"));
    assertEquals(ImprovementDirection.DOWN, ImprovementDirection.fromString("DOWN"));
    assertEquals(ImprovementDirection.UNKNOWN, ImprovementDirection.fromString("sideways"));
    assertEquals(ImprovementDirection.UNKNOWN, ImprovementDirection.fromString(null));
  }

  @Test
  void isImprovement_followsDirection() {
    assertTrue(ImprovementDirection.UP.isImprovement(10, 20));
    assertFalse(ImprovementDirection.UP.isImprovement(20, 10));
    assertTrue(ImprovementDirection.DOWN.isImprovement(20, 10));
    assertFalse(ImprovementDirection.DOWN.isImprovement(10, 20));
    assertFalse(ImprovementDirection.UNKNOWN.isImprovement(10, 20));
    assertFalse(ImprovementDirection.UNKNOWN.isImprovement(20, 10));
  }
}
