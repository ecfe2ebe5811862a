package asl.polarimeter.optics;

import static asl.polarimeter.test.TestUtils.assertMatrixEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import asl.polarimeter.input.StokesVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.Test;

public class MuellerMatricesTest {

  private static final RealMatrix IDENTITY = MatrixUtils.createRealIdentityMatrix(4);

  @Test
  public void rotation_inverseIsNegativeAngle() {
    for (double theta = -720.; theta <= 720.; theta += 7.3) {
      RealMatrix product =
          MuellerMatrices.rotation(theta).multiply(MuellerMatrices.rotation(-theta));
      assertMatrixEquals(IDENTITY, product, 1E-9);
    }
  }

  @Test
  public void rotation_periodicIn180Degrees() {
    assertMatrixEquals(MuellerMatrices.rotation(33.),
        MuellerMatrices.rotation(213.), 1E-12);
  }

  @Test
  public void rotation_leavesIntensityAndCircularAlone() {
    RealMatrix rot = MuellerMatrices.rotation(41.);
    assertEquals(1., rot.getEntry(0, 0), 0.);
    assertEquals(1., rot.getEntry(3, 3), 0.);
    assertEquals(0., rot.getEntry(0, 1), 0.);
    assertEquals(0., rot.getEntry(3, 2), 0.);
  }

  @Test
  public void halfWavePlate_twiceIsIdentity() {
    StokesVector input = new StokesVector(1., 0.3, -0.2, 0.1);
    for (double theta = 0.; theta < 360.; theta += 11.25) {
      RealMatrix hwp = MuellerMatrices.halfWavePlate(theta);
      RealVector out = hwp.multiply(hwp).operate(input.toRealVector());
      for (int i = 0; i < 4; ++i) {
        assertEquals(input.toArray()[i], out.getEntry(i), 1E-12);
      }
    }
  }

  @Test
  public void halfWavePlate_matchesRotatedRetarder() {
    for (double theta = 0.; theta < 180.; theta += 15.) {
      RealMatrix closedForm = MuellerMatrices.halfWavePlate(theta);
      RealMatrix composed = MuellerMatrices.rotated(
          MuellerMatrices.retarder(MuellerMatrices.HALF_WAVE_RETARDANCE), theta);
      assertMatrixEquals(composed, closedForm, 1E-12);
    }
  }

  @Test
  public void halfWavePlate_isSymmetric() {
    RealMatrix hwp = MuellerMatrices.halfWavePlate(17.);
    assertMatrixEquals(hwp.transpose(), hwp, 0.);
  }

  @Test
  public void halfWavePlate_at22point5SwapsQAndU() {
    RealVector out = MuellerMatrices.halfWavePlate(22.5)
        .operate(new StokesVector(1., 1., 0., 0.).toRealVector());
    assertEquals(0., out.getEntry(1), 1E-12);
    assertEquals(1., out.getEntry(2), 1E-12);
  }

  @Test
  public void diattenuatingRetarder_zeroDiattenuationIsRetarder() {
    assertMatrixEquals(MuellerMatrices.retarder(73.),
        MuellerMatrices.diattenuatingRetarder(0., 73.), 1E-15);
  }

  @Test
  public void diattenuatingRetarder_structure() {
    double d = 0.9662;
    RealMatrix m = MuellerMatrices.diattenuatingRetarder(d, 186.6);
    double k = Math.sqrt(1 - d * d);
    double r = Math.toRadians(186.6);
    assertEquals(d, m.getEntry(0, 1), 0.);
    assertEquals(d, m.getEntry(1, 0), 0.);
    assertEquals(k * Math.cos(r), m.getEntry(2, 2), 1E-15);
    assertEquals(k * Math.sin(r), m.getEntry(2, 3), 1E-15);
    assertEquals(-k * Math.sin(r), m.getEntry(3, 2), 1E-15);
  }

  @Test
  public void diattenuatingRetarder_aboveOneGivesNaN() {
    RealMatrix m = MuellerMatrices.diattenuatingRetarder(1.5, 90.);
    assertTrue(Double.isNaN(m.getEntry(2, 2)));
  }

  @Test
  public void rotated_zeroAngleReturnsCopy() {
    RealMatrix element = MuellerMatrices.retarder(45.);
    RealMatrix rotated = MuellerMatrices.rotated(element, 0.);
    assertMatrixEquals(element, rotated, 0.);
    rotated.setEntry(0, 0, 5.);
    assertEquals(1., element.getEntry(0, 0), 0.);
  }

  @Test
  public void wollastonPrism_beamsAreComplementary() {
    RealMatrix sum = MuellerMatrices.wollastonPrism(WollastonBeam.ORDINARY)
        .add(MuellerMatrices.wollastonPrism(WollastonBeam.EXTRAORDINARY));
    assertEquals(1., sum.getEntry(0, 0), 0.);
    assertEquals(0., sum.getEntry(0, 1), 0.);
  }

}
