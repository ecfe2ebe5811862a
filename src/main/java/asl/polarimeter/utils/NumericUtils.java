package asl.polarimeter.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Class containing methods to serve as math functions, mainly for angle calcs
 * and the error statistics reported on fit parameters
 *
 * @author akearns
 */
public class NumericUtils {

  /**
   * Degrees in a full circle, the period of every rotation-type parameter in the model
   */
  public final static double FULL_CIRCLE_DEGREES = 360.;

  /**
   * Sets decimalformat object so that infinity can be printed in a text report
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

  /**
   * Wrap a degree to be in the half-open range [0, 360)
   *
   * @param angle in degrees
   * @return same angle but between 0 (inclusive) and 360 (exclusive)
   */
  public static double wrapAngleDegreesPositive(double angle) {
    if (angle >= 0. && angle < FULL_CIRCLE_DEGREES) {
      return angle;
    }
    return ((angle % FULL_CIRCLE_DEGREES) + FULL_CIRCLE_DEGREES) % FULL_CIRCLE_DEGREES;
  }

  /**
   * Percent error of an estimate relative to a known reference value,
   * 100 * |estimate - reference| / reference.
   *
   * @param estimate Value produced by a fit
   * @param reference Known (true) value
   * @return Error as a percentage of the reference value
   */
  public static double percentError(double estimate, double reference) {
    return 100. * Math.abs(estimate - reference) / Math.abs(reference);
  }

  /**
   * Get percent error of each estimate against the reference value at the same index
   *
   * @param estimates Values produced by a fit
   * @param references Known values, same length as estimates
   * @return Array of percent errors
   */
  public static double[] percentErrors(double[] estimates, double[] references) {
    if (estimates.length != references.length) {
      throw new IllegalArgumentException("Estimate and reference arrays differ in length: "
          + estimates.length + " vs. " + references.length);
    }
    double[] errors = new double[estimates.length];
    for (int i = 0; i < errors.length; ++i) {
      errors[i] = percentError(estimates[i], references[i]);
    }
    return errors;
  }

  /**
   * Column-wise mean of a list of equal-length rows (i.e., the mean of each fit parameter
   * over several independent fits)
   *
   * @param rows Rows of values, all the same length
   * @return Mean of each column, or empty array if no rows given
   */
  public static double[] columnMeans(double[][] rows) {
    if (rows.length == 0) {
      return new double[]{};
    }
    double[] means = new double[rows[0].length];
    for (int j = 0; j < means.length; ++j) {
      DescriptiveStatistics stats = new DescriptiveStatistics();
      for (double[] row : rows) {
        stats.addValue(row[j]);
      }
      means[j] = stats.getMean();
    }
    return means;
  }

}
