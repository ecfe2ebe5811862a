package asl.polarimeter.experiment;

import asl.polarimeter.input.CalibrationConfiguration;
import asl.polarimeter.input.MeasurementStore;
import asl.polarimeter.input.StandardStar;
import asl.polarimeter.input.StokesVector;
import asl.polarimeter.optics.BeamIntensities;
import asl.polarimeter.optics.InstrumentModel;
import asl.polarimeter.optics.RetarderParameters;
import asl.polarimeter.utils.NumericUtils;
import asl.polarimeter.utils.ObservingGeometry;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Simulates observations of polarized standard stars through the full instrument train and then
 * recovers the derotator and tertiary mirror diattenuation and retardance from them by a bounded
 * Levenberg-Marquardt fit. One independent pass is run per configured HWP angle.
 *
 * Each standard is observed at each configured hour angle. The parallactic angle rotates the
 * sky, the mirror sits at the telescope altitude, and the derotator tracks half the parallactic
 * angle, so every observation sees a different orientation of both retarders; that variety is
 * what makes all four parameters identifiable. Noise is Gaussian with a standard deviation of
 * |intensity| / SNR, drawn from a generator seeded with the configured seed plus the pass index.
 *
 * A pass whose solver gives up is reported with a {@link FitNonConvergenceException} and the
 * remaining passes still run.
 */
public class CalibrationFitExperiment extends Experiment {

  private static final Logger logger = Logger.getLogger(CalibrationFitExperiment.class);

  /**
   * Relative step of the forward-difference Jacobian
   */
  private static final double JACOBIAN_STEP = 1E-8;

  private static final double[] UPPER_BOUNDS = {
      RetarderParameters.MAX_DIATTENUATION, RetarderParameters.MAX_RETARDANCE,
      RetarderParameters.MAX_DIATTENUATION, RetarderParameters.MAX_RETARDANCE
  };

  private CalibrationConfiguration configuration;
  private List<CalibrationEstimate> estimates;
  private double[] meanEstimate;
  private double[] meanPercentErrors;

  public CalibrationFitExperiment() {
    super();
    estimates = new ArrayList<>();
  }

  /**
   * One simulated observation: a standard star at one hour angle
   */
  static class Observation {

    final StokesVector stokes;
    final double parallacticAngle;
    final double altitude;

    Observation(StokesVector stokes, double parallacticAngle, double altitude) {
      this.stokes = stokes;
      this.parallacticAngle = parallacticAngle;
      this.altitude = altitude;
    }
  }

  /**
   * Lay out the observations for one pass: every standard at every hour angle, with the
   * polarization position angle equal to the pass's HWP angle
   *
   * @param config Catalog, hour angles and latitude to observe with
   * @param hwpAngle HWP angle of this pass (degrees)
   * @return observations in star-major order
   */
  static List<Observation> planObservations(CalibrationConfiguration config, double hwpAngle) {
    List<Observation> observations = new ArrayList<>();
    for (StandardStar star : config.getStandards()) {
      double dec = star.getDecDegrees();
      StokesVector stokes = star.getStokes(hwpAngle);
      for (double hourAngle : config.getHourAngles()) {
        double pa = ObservingGeometry.parallacticAngle(hourAngle, dec, config.getLatitude());
        double alt = ObservingGeometry.altitude(hourAngle, dec, config.getLatitude());
        observations.add(new Observation(stokes, pa, alt));
      }
    }
    return observations;
  }

  /**
   * Predict both beam intensities of every observation for a set of retarder parameters
   *
   * @param parameters derotator d, derotator r, mirror d, mirror r
   * @param observations Observations to predict
   * @param hwpAngle HWP angle of the pass (degrees)
   * @return intensities (I+_1, I-_1, I+_2, I-_2, ...)
   */
  static double[] predictIntensities(double[] parameters, List<Observation> observations,
      double hwpAngle) {
    RetarderParameters derotator = new RetarderParameters(parameters[0], parameters[1]);
    RetarderParameters mirror = new RetarderParameters(parameters[2], parameters[3]);
    double[] intensities = new double[2 * observations.size()];
    for (int i = 0; i < observations.size(); ++i) {
      Observation obs = observations.get(i);
      BeamIntensities beams = InstrumentModel.instrumentTrain(
          hwpAngle, obs.parallacticAngle, obs.altitude, mirror, derotator)
          .beamIntensities(obs.stokes);
      intensities[2 * i] = beams.getPlus();
      intensities[2 * i + 1] = beams.getMinus();
    }
    return intensities;
  }

  /**
   * Add Gaussian noise with standard deviation |value| / SNR to each value
   *
   * @param clean Noiseless intensities
   * @param signalToNoise SNR; infinite means the values are returned unchanged
   * @param seed Seed for the noise generator
   * @return noisy copy of the intensities
   */
  static double[] addNoise(double[] clean, double signalToNoise, long seed) {
    double[] noisy = clean.clone();
    if (Double.isInfinite(signalToNoise)) {
      return noisy;
    }
    RandomGenerator random = new Well19937c(seed);
    for (int i = 0; i < noisy.length; ++i) {
      noisy[i] += random.nextGaussian() * Math.abs(clean[i]) / signalToNoise;
    }
    return noisy;
  }

  /**
   * Evaluate the predicted intensities and estimate the Jacobian by forward difference.
   * A parameter too close to its upper bound for a forward step is differenced backward instead,
   * so that diattenuation is never evaluated above 1.
   *
   * @param variables Current parameter values
   * @param observations Observations of the pass
   * @param hwpAngle HWP angle of the pass
   * @return Pair of the evaluation and the Jacobian at that point
   */
  static Pair<RealVector, RealMatrix> jacobian(RealVector variables,
      List<Observation> observations, double hwpAngle) {
    double[] currentVars = variables.toArray();
    double[] predicted = predictIntensities(currentVars, observations, hwpAngle);

    double[][] jacobian = new double[predicted.length][currentVars.length];
    for (int i = 0; i < currentVars.length; ++i) {
      double[] changedVars = Arrays.copyOf(currentVars, currentVars.length);
      double diffX = JACOBIAN_STEP * Math.max(1., Math.abs(currentVars[i]));
      if (currentVars[i] + diffX > UPPER_BOUNDS[i]) {
        diffX = -diffX;
      }
      changedVars[i] += diffX;
      double[] diffY = predictIntensities(changedVars, observations, hwpAngle);
      for (int j = 0; j < diffY.length; ++j) {
        jacobian[j][i] = (diffY[j] - predicted[j]) / diffX;
      }
    }

    return new Pair<>(MatrixUtils.createRealVector(predicted),
        MatrixUtils.createRealMatrix(jacobian));
  }

  /**
   * Run a single pass: simulate, then fit
   *
   * @param config Calibration configuration
   * @param passIndex Index of the pass, added to the seed
   * @param hwpAngle HWP angle of the pass
   * @return estimate for the pass, with its failure if the solver gave up
   */
  static CalibrationEstimate runPass(CalibrationConfiguration config, int passIndex,
      double hwpAngle) {
    final List<Observation> observations = planObservations(config, hwpAngle);
    double[] trueValues = config.getTrueParameters();
    double[] clean = predictIntensities(trueValues, observations, hwpAngle);
    double[] noisy = addNoise(clean, config.getSignalToNoise(), config.getSeed() + passIndex);

    MultivariateJacobianFunction model =
        point -> jacobian(point, observations, hwpAngle);

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(config.getInitialGuess()).
        target(noisy).
        model(model).
        parameterValidator(new RetarderValidator()).
        lazyEvaluation(false).
        maxEvaluations(config.getMaxEvaluations()).
        maxIterations(config.getMaxIterations()).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(config.getCostRelativeTolerance()).
        withOrthoTolerance(config.getOrthoTolerance()).
        withParameterRelativeTolerance(config.getParameterRelativeTolerance());

    LeastSquaresOptimizer.Optimum optimum;
    try {
      optimum = optimizer.optimize(lsp);
    } catch (MathIllegalStateException e) {
      // too many iterations or evaluations, or tolerances that cannot be met
      FitNonConvergenceException failure = new FitNonConvergenceException(hwpAngle, e);
      logger.warn(failure.getMessage());
      return new CalibrationEstimate(hwpAngle, failure);
    }

    CalibrationEstimate estimate = new CalibrationEstimate(hwpAngle,
        optimum.getPoint().toArray(), trueValues, optimum.getIterations(),
        optimum.getEvaluations(), optimum.getRMS());
    logger.info("Fit pass at HWP " + hwpAngle + " converged in " + optimum.getIterations()
        + " iterations: " + estimate);
    return estimate;
  }

  @Override
  protected void backend(MeasurementStore store) {
    if (configuration == null) {
      configuration = CalibrationConfiguration.builder().build();
    }
    for (StandardStar star : configuration.getStandards()) {
      dataNames.add(star.getName());
    }

    estimates = new ArrayList<>();
    double[] hwpAngles = configuration.getHwpAngles();
    for (int i = 0; i < hwpAngles.length; ++i) {
      fireStateChange("Fitting pass " + (i + 1) + " of " + hwpAngles.length
          + " (HWP " + hwpAngles[i] + ")...");
      estimates.add(runPass(configuration, i, hwpAngles[i]));
    }

    List<double[]> converged = new ArrayList<>();
    for (CalibrationEstimate estimate : estimates) {
      if (estimate.isConverged()) {
        converged.add(estimate.getEstimates());
      }
    }
    if (converged.isEmpty()) {
      logger.error("No calibration pass converged");
      meanEstimate = new double[CalibrationEstimate.PARAMETER_NAMES.length];
      Arrays.fill(meanEstimate, Double.NaN);
      meanPercentErrors = meanEstimate.clone();
    } else {
      meanEstimate = NumericUtils.columnMeans(converged.toArray(new double[][]{}));
      meanPercentErrors =
          NumericUtils.percentErrors(meanEstimate, configuration.getTrueParameters());
    }

    fireStateChange("Building percent error series...");
    XYSeriesCollection errorCurves = new XYSeriesCollection();
    for (int j = 0; j < CalibrationEstimate.PARAMETER_NAMES.length; ++j) {
      XYSeries series = new XYSeries("% error, " + CalibrationEstimate.PARAMETER_NAMES[j]);
      for (CalibrationEstimate estimate : estimates) {
        if (estimate.isConverged()) {
          series.add(estimate.getHwpAngle(), estimate.getPercentErrors()[j]);
        }
      }
      errorCurves.addSeries(series);
    }
    xySeriesData.add(errorCurves);
  }

  /**
   * @return per-pass estimates, in HWP angle order, including passes that failed
   */
  public List<CalibrationEstimate> getEstimates() {
    return Collections.unmodifiableList(estimates);
  }

  /**
   * @return mean of each parameter over converged passes (NaN if none converged)
   */
  public double[] getMeanEstimate() {
    return meanEstimate.clone();
  }

  /**
   * @return percent error of the mean estimate against the true parameters
   */
  public double[] getMeanPercentErrors() {
    return meanPercentErrors.clone();
  }

  /**
   * Average of every parameter's percent error over every converged pass
   * @return single figure of merit for the fit, NaN if no pass converged
   */
  public double getAveragePercentError() {
    double sum = 0.;
    int count = 0;
    for (CalibrationEstimate estimate : estimates) {
      if (!estimate.isConverged()) {
        continue;
      }
      for (double error : estimate.getPercentErrors()) {
        sum += error;
        ++count;
      }
    }
    return count == 0 ? Double.NaN : sum / count;
  }

  public int getFailedPassCount() {
    int failed = 0;
    for (CalibrationEstimate estimate : estimates) {
      if (!estimate.isConverged()) {
        ++failed;
      }
    }
    return failed;
  }

  public CalibrationConfiguration getConfiguration() {
    return configuration;
  }

  public void setConfiguration(CalibrationConfiguration configuration) {
    this.configuration = configuration;
  }

  @Override
  String[] getDataStrings() {
    DecimalFormat df = DECIMAL_FORMAT.get();
    List<String> strings = new ArrayList<>();
    for (CalibrationEstimate estimate : estimates) {
      StringBuilder sb = new StringBuilder();
      sb.append("HWP angle ").append(df.format(estimate.getHwpAngle())).append(":\n");
      if (!estimate.isConverged()) {
        sb.append(estimate.getFailure().getMessage());
        strings.add(sb.toString());
        continue;
      }
      double[] values = estimate.getEstimates();
      double[] errors = estimate.getPercentErrors();
      for (int j = 0; j < values.length; ++j) {
        sb.append(CalibrationEstimate.PARAMETER_NAMES[j]).append(": ")
            .append(df.format(values[j])).append(" (")
            .append(df.format(errors[j])).append("% error)\n");
      }
      sb.append("Iterations: ").append(estimate.getIterations());
      sb.append("\nRMS residual: ").append(df.format(estimate.getRmsResidual()));
      strings.add(sb.toString());
    }
    StringBuilder mean = new StringBuilder("Mean over converged passes:\n");
    for (int j = 0; j < meanEstimate.length; ++j) {
      mean.append(CalibrationEstimate.PARAMETER_NAMES[j]).append(": ")
          .append(df.format(meanEstimate[j])).append(" (")
          .append(df.format(meanPercentErrors[j])).append("% error)");
      if (j + 1 < meanEstimate.length) {
        mean.append('\n');
      }
    }
    strings.add(mean.toString());
    return strings.toArray(new String[]{});
  }

  @Override
  public int measurementsNeeded() {
    return 0;
  }

  /**
   * Observations are simulated from the configuration, so no loaded data is required
   */
  @Override
  public boolean hasEnoughData(MeasurementStore store) {
    return true;
  }

  /**
   * Keeps diattenuation in [0, 1] by clamping and retardance in [0, 360) by wrapping
   */
  private static class RetarderValidator implements ParameterValidator {

    @Override
    public RealVector validate(RealVector params) {
      for (int i = 0; i < params.getDimension(); ++i) {
        double value = params.getEntry(i);
        if (i % 2 == 0) {
          // even index means this is a diattenuation
          value = Math.max(RetarderParameters.MIN_DIATTENUATION,
              Math.min(RetarderParameters.MAX_DIATTENUATION, value));
        } else {
          value = NumericUtils.wrapAngleDegreesPositive(value);
        }
        params.setEntry(i, value);
      }
      return params;
    }
  }

}
