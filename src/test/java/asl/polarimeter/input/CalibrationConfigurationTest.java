package asl.polarimeter.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.polarimeter.utils.ObservingGeometry;
import java.util.Collections;
import org.junit.Test;

public class CalibrationConfigurationTest {

  @Test
  public void builder_defaults() {
    CalibrationConfiguration config = CalibrationConfiguration.builder().build();
    assertArrayEquals(new double[]{0.9662, 186.6, 0.9761, 186.6},
        config.getTrueParameters(), 0.);
    assertArrayEquals(new double[]{0.9, 200., 0.9, 200.}, config.getInitialGuess(), 0.);
    assertArrayEquals(new double[]{0., 22.5, 45., 60.}, config.getHwpAngles(), 0.);
    assertArrayEquals(new double[]{-45., 0., 45.}, config.getHourAngles(), 0.);
    assertEquals(3, config.getStandards().size());
    assertEquals(ObservingGeometry.KECK_LATITUDE, config.getLatitude(), 0.);
    assertTrue(Double.isInfinite(config.getSignalToNoise()));
  }

  @Test
  public void defaultAngles_cannotBeChangedByCallers() {
    CalibrationConfiguration.getDefaultHwpAngles()[0] = 90.;
    CalibrationConfiguration.getDefaultHourAngles()[1] = 30.;
    assertArrayEquals(new double[]{0., 22.5, 45., 60.},
        CalibrationConfiguration.getDefaultHwpAngles(), 0.);
    assertArrayEquals(new double[]{-45., 0., 45.},
        CalibrationConfiguration.getDefaultHourAngles(), 0.);

    CalibrationConfiguration config = CalibrationConfiguration.builder().build();
    config.getHwpAngles()[0] = 90.;
    assertArrayEquals(new double[]{0., 22.5, 45., 60.},
        CalibrationConfiguration.builder().build().getHwpAngles(), 0.);
    assertEquals(0., config.getHwpAngles()[0], 0.);
  }

  @Test
  public void builder_overrides() {
    CalibrationConfiguration config = CalibrationConfiguration.builder()
        .trueDerotator(0.5, 90.)
        .initialMirror(0.4, 100.)
        .hwpAngles(10.)
        .signalToNoise(1E6)
        .seed(7L)
        .maxIterations(12)
        .build();
    assertEquals(0.5, config.getTrueDerotator().getDiattenuation(), 0.);
    assertEquals(100., config.getInitialMirror().getRetardance(), 0.);
    assertArrayEquals(new double[]{10.}, config.getHwpAngles(), 0.);
    assertEquals(1E6, config.getSignalToNoise(), 0.);
    assertEquals(7L, config.getSeed());
    assertEquals(12, config.getMaxIterations());
  }

  @Test
  public void build_rejectsDiattenuationAboveOne() {
    try {
      CalibrationConfiguration.builder().initialDerotator(1.2, 200.).build();
      fail("Expected out-of-bounds initial guess to be rejected");
    } catch (ParameterOutOfBoundsException e) {
      assertEquals("initial derotator diattenuation", e.getParameterName());
      assertEquals(1.2, e.getValue(), 0.);
    }
  }

  @Test(expected = ParameterOutOfBoundsException.class)
  public void build_rejectsRetardanceOf360() {
    CalibrationConfiguration.builder().initialMirror(0.9, 360.).build();
  }

  @Test(expected = ParameterOutOfBoundsException.class)
  public void build_rejectsNegativeTrueDiattenuation() {
    CalibrationConfiguration.builder().trueMirror(-0.1, 186.6).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void build_rejectsEmptyCatalog() {
    CalibrationConfiguration.builder()
        .standards(Collections.<StandardStar>emptyList()).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void build_rejectsNonPositiveSignalToNoise() {
    CalibrationConfiguration.builder().signalToNoise(0.).build();
  }

  @Test
  public void hwpAngles_areCopied() {
    double[] angles = {0., 45.};
    CalibrationConfiguration config = CalibrationConfiguration.builder().hwpAngles(angles).build();
    angles[0] = 99.;
    config.getHwpAngles()[1] = 99.;
    assertArrayEquals(new double[]{0., 45.}, config.getHwpAngles(), 0.);
  }

  @Test
  public void standardStar_coordinates() {
    StandardStar star = StandardStar.DEFAULT_CATALOG.get(0);
    assertEquals("HDE 279652", star.getName());
    assertEquals(ObservingGeometry.hoursToDegrees(4, 14, 50.2), star.getRaDegrees(), 0.);
    assertEquals(37.598333333, star.getDecDegrees(), 1E-8);
    assertEquals(0.0061, star.getPolarizationFraction(), 0.);
    assertEquals(0.0061, star.getStokes(0.).getQ(), 1E-15);
  }

}
