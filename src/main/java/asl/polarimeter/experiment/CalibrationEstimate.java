package asl.polarimeter.experiment;

import asl.polarimeter.utils.NumericUtils;
import java.util.Arrays;

/**
 * Outcome of one calibration pass (one HWP angle). Parameters are in fit order:
 * derotator diattenuation, derotator retardance, mirror diattenuation, mirror retardance.
 * A pass that did not converge carries its failure and NaN estimates.
 */
public class CalibrationEstimate {

  public static final String[] PARAMETER_NAMES = {
      "Derotator diattenuation", "Derotator retardance",
      "Mirror diattenuation", "Mirror retardance"
  };

  private final double hwpAngle;
  private final double[] estimates;
  private final double[] percentErrors;
  private final int iterations;
  private final int evaluations;
  private final double rmsResidual;
  private final FitNonConvergenceException failure;

  CalibrationEstimate(double hwpAngle, double[] estimates, double[] trueValues,
      int iterations, int evaluations, double rmsResidual) {
    this.hwpAngle = hwpAngle;
    this.estimates = estimates.clone();
    this.percentErrors = NumericUtils.percentErrors(estimates, trueValues);
    this.iterations = iterations;
    this.evaluations = evaluations;
    this.rmsResidual = rmsResidual;
    this.failure = null;
  }

  CalibrationEstimate(double hwpAngle, FitNonConvergenceException failure) {
    this.hwpAngle = hwpAngle;
    this.estimates = new double[PARAMETER_NAMES.length];
    Arrays.fill(estimates, Double.NaN);
    this.percentErrors = estimates.clone();
    this.iterations = 0;
    this.evaluations = 0;
    this.rmsResidual = Double.NaN;
    this.failure = failure;
  }

  public double getHwpAngle() {
    return hwpAngle;
  }

  public double[] getEstimates() {
    return estimates.clone();
  }

  /**
   * @return 100 * |estimate - true| / true for each parameter
   */
  public double[] getPercentErrors() {
    return percentErrors.clone();
  }

  public boolean isConverged() {
    return failure == null;
  }

  public int getIterations() {
    return iterations;
  }

  public int getEvaluations() {
    return evaluations;
  }

  public double getRmsResidual() {
    return rmsResidual;
  }

  /**
   * @return solver failure for this pass, or null if it converged
   */
  public FitNonConvergenceException getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    if (!isConverged()) {
      return "HWP " + hwpAngle + ": " + failure.getMessage();
    }
    return "HWP " + hwpAngle + ": " + Arrays.toString(estimates)
        + " (% error " + Arrays.toString(percentErrors) + ")";
  }

}
