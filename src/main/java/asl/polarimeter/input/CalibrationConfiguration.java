package asl.polarimeter.input;

import asl.polarimeter.optics.RetarderParameters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything the calibration fit needs to simulate and then recover the derotator and tertiary
 * mirror parameters: true values, standard stars, observing geometry, the HWP angles to run
 * passes at, the initial guess, simulation noise and solver limits.
 *
 * Instances are immutable; use {@link #builder()}, which starts from the defaults and the
 * values in {@link Configuration}.
 */
public class CalibrationConfiguration {

  public static final RetarderParameters DEFAULT_DEROTATOR = new RetarderParameters(0.9662, 186.6);
  public static final RetarderParameters DEFAULT_MIRROR = new RetarderParameters(0.9761, 186.6);
  public static final RetarderParameters DEFAULT_GUESS = new RetarderParameters(0.9, 200.);
  private static final double[] DEFAULT_HWP_ANGLES = {0., 22.5, 45., 60.};
  private static final double[] DEFAULT_HOUR_ANGLES = {-45., 0., 45.};

  private final RetarderParameters trueDerotator;
  private final RetarderParameters trueMirror;
  private final RetarderParameters initialDerotator;
  private final RetarderParameters initialMirror;
  private final List<StandardStar> standards;
  private final double latitude;
  private final double[] hourAngles;
  private final double[] hwpAngles;
  private final double signalToNoise;
  private final long seed;
  private final double costRelativeTolerance;
  private final double parameterRelativeTolerance;
  private final double orthoTolerance;
  private final int maxIterations;
  private final int maxEvaluations;

  private CalibrationConfiguration(Builder builder) {
    trueDerotator = builder.trueDerotator;
    trueMirror = builder.trueMirror;
    initialDerotator = builder.initialDerotator;
    initialMirror = builder.initialMirror;
    standards = Collections.unmodifiableList(new ArrayList<>(builder.standards));
    latitude = builder.latitude;
    hourAngles = builder.hourAngles.clone();
    hwpAngles = builder.hwpAngles.clone();
    signalToNoise = builder.signalToNoise;
    seed = builder.seed;
    costRelativeTolerance = builder.costRelativeTolerance;
    parameterRelativeTolerance = builder.parameterRelativeTolerance;
    orthoTolerance = builder.orthoTolerance;
    maxIterations = builder.maxIterations;
    maxEvaluations = builder.maxEvaluations;
  }

  /**
   * @return HWP angles (degrees) a calibration runs passes at unless told otherwise
   */
  public static double[] getDefaultHwpAngles() {
    return DEFAULT_HWP_ANGLES.clone();
  }

  /**
   * @return hour angles (degrees) each standard is observed at unless told otherwise
   */
  public static double[] getDefaultHourAngles() {
    return DEFAULT_HOUR_ANGLES.clone();
  }

  public static Builder builder() {
    return new Builder(Configuration.getInstance());
  }

  /**
   * @param config Source of the simulation and solver defaults
   * @return builder starting from the given configuration's values
   */
  public static Builder builder(Configuration config) {
    return new Builder(config);
  }

  public RetarderParameters getTrueDerotator() {
    return trueDerotator;
  }

  public RetarderParameters getTrueMirror() {
    return trueMirror;
  }

  public RetarderParameters getInitialDerotator() {
    return initialDerotator;
  }

  public RetarderParameters getInitialMirror() {
    return initialMirror;
  }

  /**
   * Get true parameters in fit order: derotator d, derotator r, mirror d, mirror r
   * @return array of the four true values
   */
  public double[] getTrueParameters() {
    return new double[]{
        trueDerotator.getDiattenuation(), trueDerotator.getRetardance(),
        trueMirror.getDiattenuation(), trueMirror.getRetardance()};
  }

  /**
   * Get initial guess in fit order: derotator d, derotator r, mirror d, mirror r
   * @return array of the four starting values
   */
  public double[] getInitialGuess() {
    return new double[]{
        initialDerotator.getDiattenuation(), initialDerotator.getRetardance(),
        initialMirror.getDiattenuation(), initialMirror.getRetardance()};
  }

  public List<StandardStar> getStandards() {
    return standards;
  }

  public double getLatitude() {
    return latitude;
  }

  public double[] getHourAngles() {
    return hourAngles.clone();
  }

  public double[] getHwpAngles() {
    return hwpAngles.clone();
  }

  public double getSignalToNoise() {
    return signalToNoise;
  }

  public long getSeed() {
    return seed;
  }

  public double getCostRelativeTolerance() {
    return costRelativeTolerance;
  }

  public double getParameterRelativeTolerance() {
    return parameterRelativeTolerance;
  }

  public double getOrthoTolerance() {
    return orthoTolerance;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public static class Builder {

    private RetarderParameters trueDerotator = DEFAULT_DEROTATOR;
    private RetarderParameters trueMirror = DEFAULT_MIRROR;
    private RetarderParameters initialDerotator = DEFAULT_GUESS;
    private RetarderParameters initialMirror = DEFAULT_GUESS;
    private List<StandardStar> standards = StandardStar.DEFAULT_CATALOG;
    private double latitude;
    private double[] hourAngles = DEFAULT_HOUR_ANGLES;
    private double[] hwpAngles = DEFAULT_HWP_ANGLES;
    private double signalToNoise;
    private long seed;
    private double costRelativeTolerance;
    private double parameterRelativeTolerance;
    private double orthoTolerance;
    private int maxIterations;
    private int maxEvaluations;

    private Builder(Configuration config) {
      latitude = config.getLatitude();
      signalToNoise = config.getSignalToNoise();
      seed = config.getSeed();
      costRelativeTolerance = config.getCostRelativeTolerance();
      parameterRelativeTolerance = config.getParameterRelativeTolerance();
      orthoTolerance = config.getOrthoTolerance();
      maxIterations = config.getMaxIterations();
      maxEvaluations = config.getMaxEvaluations();
    }

    public Builder trueDerotator(double diattenuation, double retardance) {
      trueDerotator = new RetarderParameters(diattenuation, retardance);
      return this;
    }

    public Builder trueMirror(double diattenuation, double retardance) {
      trueMirror = new RetarderParameters(diattenuation, retardance);
      return this;
    }

    public Builder initialDerotator(double diattenuation, double retardance) {
      initialDerotator = new RetarderParameters(diattenuation, retardance);
      return this;
    }

    public Builder initialMirror(double diattenuation, double retardance) {
      initialMirror = new RetarderParameters(diattenuation, retardance);
      return this;
    }

    public Builder standards(List<StandardStar> standards) {
      this.standards = standards;
      return this;
    }

    public Builder latitude(double latitude) {
      this.latitude = latitude;
      return this;
    }

    public Builder hourAngles(double... hourAngles) {
      this.hourAngles = hourAngles.clone();
      return this;
    }

    public Builder hwpAngles(double... hwpAngles) {
      this.hwpAngles = hwpAngles.clone();
      return this;
    }

    /**
     * @param signalToNoise Ratio of clean intensity to noise deviation; infinity for no noise
     * @return this builder
     */
    public Builder signalToNoise(double signalToNoise) {
      this.signalToNoise = signalToNoise;
      return this;
    }

    public Builder seed(long seed) {
      this.seed = seed;
      return this;
    }

    public Builder costRelativeTolerance(double tolerance) {
      costRelativeTolerance = tolerance;
      return this;
    }

    public Builder parameterRelativeTolerance(double tolerance) {
      parameterRelativeTolerance = tolerance;
      return this;
    }

    public Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    public Builder maxEvaluations(int maxEvaluations) {
      this.maxEvaluations = maxEvaluations;
      return this;
    }

    /**
     * Check the parameters and build the configuration
     * @return new immutable configuration
     * @throws ParameterOutOfBoundsException if any true or initial parameter is outside the
     * solver bounds
     * @throws IllegalArgumentException if there are no standards, hour angles or HWP angles,
     * or the signal-to-noise ratio is not positive
     */
    public CalibrationConfiguration build() {
      checkBounds("derotator", trueDerotator);
      checkBounds("mirror", trueMirror);
      checkBounds("initial derotator", initialDerotator);
      checkBounds("initial mirror", initialMirror);
      if (standards.isEmpty()) {
        throw new IllegalArgumentException("At least one standard star is needed");
      }
      if (hourAngles.length == 0 || hwpAngles.length == 0) {
        throw new IllegalArgumentException("Need at least one hour angle and one HWP angle");
      }
      if (!(signalToNoise > 0)) {
        throw new IllegalArgumentException("Signal-to-noise must be positive: " + signalToNoise);
      }
      return new CalibrationConfiguration(this);
    }

    private static void checkBounds(String name, RetarderParameters parameters) {
      double d = parameters.getDiattenuation();
      if (!(d >= RetarderParameters.MIN_DIATTENUATION
          && d <= RetarderParameters.MAX_DIATTENUATION)) {
        throw new ParameterOutOfBoundsException(name + " diattenuation", d);
      }
      double r = parameters.getRetardance();
      if (!(r >= RetarderParameters.MIN_RETARDANCE && r < RetarderParameters.MAX_RETARDANCE)) {
        throw new ParameterOutOfBoundsException(name + " retardance", r);
      }
    }
  }

}
