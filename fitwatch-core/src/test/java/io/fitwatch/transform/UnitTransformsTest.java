package io.fitwatch.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnitTransformsTest {

  @Test
  void cadenceIsDoubled() {
    assertEquals(160.0, UnitTransforms.cadenceToSpm(80));
    assertEquals(171.0, UnitTransforms.cadenceToSpm(85.5));
  }

  @Test
  void numericStringsAreAccepted() {
    assertEquals(160.0, UnitTransforms.cadenceToSpm("80"));
    assertEquals("13:25", UnitTransforms.paceFromSpeed("2.0"));
  }

  @Test
  void missingOrNonNumericValuesGiveNull() {
    assertNull(UnitTransforms.cadenceToSpm(null));
    assertNull(UnitTransforms.cadenceToSpm("fast"));
    assertNull(UnitTransforms.semicirclesToDegrees(null));
    assertNull(UnitTransforms.paceFromSpeed(null));
  }

  @Test
  void paceFromTwoMetersPerSecond() {
    // 1609.344 / 2.0 = 804.672 s = 13 min 24.672 s
    assertEquals("13:25", UnitTransforms.paceFromSpeed(2.0));
  }

  @Test
  void paceIsZeroPadded() {
    // 1609.344 / 5.0 = 321.8688 s = 5 min 21.87 s
    assertEquals("05:22", UnitTransforms.paceFromSpeed(5.0));
  }

  @Test
  void paceRollsSixtySecondsIntoMinutes() {
    // 1609.344 / v = 599.7 s -> 9 min 59.7 s -> rounds to 60 s
    double speed = 1609.344 / 599.7;
    assertEquals("10:00", UnitTransforms.paceFromSpeed(speed));
  }

  @Test
  void paceRoundsHalfToEven() {
    // doubling the mile length gives exactly 0.5 s per mile
    assertEquals("00:00", UnitTransforms.paceFromSpeed(UnitTransforms.METERS_PER_MILE * 2));
  }

  @Test
  void nonPositiveSpeedHasNoPace() {
    assertNull(UnitTransforms.paceFromSpeed(0));
    assertNull(UnitTransforms.paceFromSpeed(-1.5));
  }

  @Test
  void semicirclesConvertToDegrees() {
    assertEquals(0.0, UnitTransforms.semicirclesToDegrees(0));
    assertEquals(179.9999998, UnitTransforms.semicirclesToDegrees(2147483647), 1e-6);
    assertEquals(-90.0, UnitTransforms.semicirclesToDegrees(-1073741824), 1e-9);
  }
}
