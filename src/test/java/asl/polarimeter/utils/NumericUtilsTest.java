package asl.polarimeter.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.text.DecimalFormat;
import org.junit.Test;

public class NumericUtilsTest {

  @Test
  public void wrapAngleDegreesPositive_wrapsIntoHalfOpenRange() {
    assertEquals(350., NumericUtils.wrapAngleDegreesPositive(-10.), 1E-12);
    assertEquals(10., NumericUtils.wrapAngleDegreesPositive(370.), 1E-12);
    assertEquals(0., NumericUtils.wrapAngleDegreesPositive(360.), 0.);
    assertEquals(186.6, NumericUtils.wrapAngleDegreesPositive(186.6), 0.);
  }

  @Test
  public void wrapAngleDegreesPositive_leavesInRangeAnglesBitIdentical() {
    double[] angles = {0., 0.1, 22.5, 186.6, 200., 359.99999999};
    for (double angle : angles) {
      assertEquals(Double.doubleToLongBits(angle),
          Double.doubleToLongBits(NumericUtils.wrapAngleDegreesPositive(angle)));
    }
  }

  @Test
  public void wrapAngleDegreesPositive_tinyNegativeDoesNotReturn360() {
    assertEquals(0., NumericUtils.wrapAngleDegreesPositive(-1E-20), 0.);
  }

  @Test
  public void percentError_relativeToReference() {
    assertEquals(10., NumericUtils.percentError(110., 100.), 1E-12);
    assertEquals(10., NumericUtils.percentError(90., 100.), 1E-12);
    assertEquals(0., NumericUtils.percentError(186.6, 186.6), 0.);
  }

  @Test
  public void percentErrors_elementwise() {
    double[] errors = NumericUtils.percentErrors(new double[]{1.1, 200.}, new double[]{1., 100.});
    assertArrayEquals(new double[]{10., 100.}, errors, 1E-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void percentErrors_lengthMismatchThrows() {
    NumericUtils.percentErrors(new double[]{1.}, new double[]{1., 2.});
  }

  @Test
  public void columnMeans_averagesEachParameter() {
    double[][] rows = {{1., 10.}, {3., 20.}, {5., 30.}};
    assertArrayEquals(new double[]{3., 20.}, NumericUtils.columnMeans(rows), 1E-12);
    assertEquals(0, NumericUtils.columnMeans(new double[][]{}).length);
  }

  @Test
  public void setInfinityPrintable_formatsInfinity() {
    DecimalFormat df = new DecimalFormat("#.##");
    NumericUtils.setInfinityPrintable(df);
    assertEquals("Inf.", df.format(Double.POSITIVE_INFINITY));
  }

}
