package asl.polarimeter.test;

import static org.junit.Assert.assertEquals;

import asl.polarimeter.input.MeasurementPair;
import asl.polarimeter.input.StokesVector;
import asl.polarimeter.optics.BeamIntensities;
import asl.polarimeter.optics.InstrumentModel;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.linear.RealMatrix;

public class TestUtils {

  public static final String TEST_DATA_LOCATION = "src/test/resources/";

  public static void assertMatrixEquals(RealMatrix expected, RealMatrix actual, double delta) {
    assertEquals(expected.getRowDimension(), actual.getRowDimension());
    assertEquals(expected.getColumnDimension(), actual.getColumnDimension());
    for (int i = 0; i < expected.getRowDimension(); ++i) {
      for (int j = 0; j < expected.getColumnDimension(); ++j) {
        assertEquals("Entry (" + i + ", " + j + ")",
            expected.getEntry(i, j), actual.getEntry(i, j), delta);
      }
    }
  }

  public static void assertStokesEquals(StokesVector expected, StokesVector actual,
      double delta) {
    double[] exp = expected.toArray();
    double[] act = actual.toArray();
    for (int i = 0; i < exp.length; ++i) {
      assertEquals("Stokes component " + i, exp[i], act[i], delta);
    }
  }

  /**
   * Produce exact measurements of a source through a model at each (HWP, parallactic) angle
   * @param stokes Source polarization
   * @param model Instrument the measurements are taken through
   * @param hwpAngles HWP angle of each measurement
   * @param parallacticAngles Parallactic angle of each measurement
   * @return noiseless measurement pairs
   */
  public static List<MeasurementPair> simulatePairs(StokesVector stokes, InstrumentModel model,
      double[] hwpAngles, double[] parallacticAngles) {
    List<MeasurementPair> pairs = new ArrayList<>();
    for (double hwp : hwpAngles) {
      for (double pa : parallacticAngles) {
        BeamIntensities beams = model.configure(hwp, pa).beamIntensities(stokes);
        pairs.add(new MeasurementPair(beams, hwp, pa));
      }
    }
    return pairs;
  }

}
