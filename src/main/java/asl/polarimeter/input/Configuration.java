package asl.polarimeter.input;

import asl.polarimeter.utils.ObservingGeometry;
import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding the numeric settings users may want to change without rebuilding:
 * the observatory latitude, the solver tolerances and iteration limits used by the calibration
 * fit, the singularity threshold of the on-sky estimator, the signal-to-noise ratio and seed of
 * simulated observations, and the step size of the modulation curve.
 *
 * Any value missing from the file keeps its default; a missing or malformed file leaves every
 * value at its default.
 */
public class Configuration {

  private static Configuration instance;

  static final String DEFAULT_CONFIG_PATH = "polarimeter-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = null;

  private double latitude = ObservingGeometry.KECK_LATITUDE;

  private double costRelativeTolerance = 1E-10;
  private double parameterRelativeTolerance = 1E-10;
  private double orthoTolerance = 1E-25;
  private int maxIterations = 500;
  private int maxEvaluations = 5000;

  private double singularityThreshold = 1E-10;

  private double signalToNoise = Double.POSITIVE_INFINITY;
  private long seed = 1234L;

  private double modulationStep = 1.;

  private Configuration(URL configLocation) {
    if (configLocation == null) {
      logger.warn("No configuration file found, using defaults");
      return;
    }
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      // read every key before assigning, so a bad value partway through changes nothing
      double readLatitude = config.getDouble("Observatory.Latitude", latitude);

      double readCostTolerance =
          config.getDouble("Solver.CostRelativeTolerance", costRelativeTolerance);
      double readParameterTolerance =
          config.getDouble("Solver.ParameterRelativeTolerance", parameterRelativeTolerance);
      double readOrthoTolerance = config.getDouble("Solver.OrthoTolerance", orthoTolerance);
      int readMaxIterations = config.getInt("Solver.MaxIterations", maxIterations);
      int readMaxEvaluations = config.getInt("Solver.MaxEvaluations", maxEvaluations);

      double readThreshold =
          config.getDouble("Estimator.SingularityThreshold", singularityThreshold);

      // "Infinity" parses to positive infinity, i.e., noiseless simulation
      double readSignalToNoise = config.getDouble("Simulation.SignalToNoise", signalToNoise);
      long readSeed = config.getLong("Simulation.Seed", seed);

      double readModulationStep = config.getDouble("Modulation.Step", modulationStep);

      latitude = readLatitude;
      costRelativeTolerance = readCostTolerance;
      parameterRelativeTolerance = readParameterTolerance;
      orthoTolerance = readOrthoTolerance;
      maxIterations = readMaxIterations;
      maxEvaluations = readMaxEvaluations;
      singularityThreshold = readThreshold;
      signalToNoise = readSignalToNoise;
      seed = readSeed;
      modulationStep = readModulationStep;

      loadedConfigPath = configLocation.toString();
      logger.info("Successfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException | RuntimeException e) {
      // XMLConfiguration reports malformed numbers as ConversionException (a RuntimeException)
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Gets the current instance of the configuration, or creates one from the file embedded in
   * the classpath if none exists
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    if (instance == null) {
      URL embedded = Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
      instance = new Configuration(embedded);
    }
    return instance;
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists. If the file does not exist the classpath copy is used instead.
   * @param configLocation Configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      instance = fromFile(configLocation);
    }
    return instance;
  }

  /**
   * Read a configuration without replacing the shared instance, used to check alternate files.
   * @param configLocation Path to an XML configuration file
   * @return new configuration, holding defaults where the file is missing or unreadable
   */
  public static Configuration fromFile(String configLocation) {
    File config = new File(configLocation);
    if (!config.exists()) {
      logger.warn("Could not find config file at " + configLocation
          + ", falling back to embedded configuration");
      return new Configuration(
          Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH));
    }
    try {
      return new Configuration(config.toURI().toURL());
    } catch (MalformedURLException e) {
      logger.error("Could not resolve config path " + configLocation + ", using defaults", e);
      return new Configuration(null);
    }
  }

  /**
   * @return Location the values were read from, or null if only defaults are in use
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Observatory latitude in degrees, defaulting to Keck (19.8260).
   *
   * The property is defined from Configuration.Observatory.Latitude
   * @return latitude in degrees
   */
  public double getLatitude() {
    return latitude;
  }

  /**
   * Relative tolerance on the cost function for the calibration fit.
   *
   * The property is defined from Configuration.Solver.CostRelativeTolerance
   * @return cost relative tolerance
   */
  public double getCostRelativeTolerance() {
    return costRelativeTolerance;
  }

  /**
   * Relative tolerance on parameter change for the calibration fit.
   *
   * The property is defined from Configuration.Solver.ParameterRelativeTolerance
   * @return parameter relative tolerance
   */
  public double getParameterRelativeTolerance() {
    return parameterRelativeTolerance;
  }

  public double getOrthoTolerance() {
    return orthoTolerance;
  }

  /**
   * Iteration limit of the calibration fit. Defaults to 500.
   *
   * The property is defined from Configuration.Solver.MaxIterations
   * @return max iterations per pass
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  /**
   * Evaluation limit of the calibration fit. Defaults to 5000.
   *
   * The property is defined from Configuration.Solver.MaxEvaluations
   * @return max evaluations per pass
   */
  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  /**
   * Smallest ratio of smallest to largest singular value the on-sky estimator accepts.
   *
   * The property is defined from Configuration.Estimator.SingularityThreshold
   * @return singularity threshold
   */
  public double getSingularityThreshold() {
    return singularityThreshold;
  }

  /**
   * Signal-to-noise ratio of simulated observations; infinite means noiseless.
   *
   * The property is defined from Configuration.Simulation.SignalToNoise
   * @return simulation SNR
   */
  public double getSignalToNoise() {
    return signalToNoise;
  }

  public long getSeed() {
    return seed;
  }

  /**
   * Step between HWP angles (degrees) of the modulation curve.
   *
   * The property is defined from Configuration.Modulation.Step
   * @return modulation step in degrees
   */
  public double getModulationStep() {
    return modulationStep;
  }

}
