package asl.polarimeter.output;

import asl.polarimeter.experiment.CalibrationEstimate;
import asl.polarimeter.experiment.CalibrationFitExperiment;
import asl.polarimeter.experiment.OnSkyExperiment;
import asl.polarimeter.experiment.WollastonExperiment;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Simple interface by which external programs can read the results of an experiment without
 * depending on the experiment classes' getters. CalResult holds a map from string descriptors to
 * the values produced, given as arrays of doubles (which have more than one entry in the case of,
 * say, a Stokes vector or the parameters fit in one calibration pass).
 * Experiments must have been run before their results are built into a CalResult.
 */
public class CalResult {

  private final Map<String, double[]> numerMap;

  private CalResult() {
    numerMap = new HashMap<>();
  }

  /**
   * Get data from a Wollaston beam experiment
   * @param experiment Experiment that has been run
   * @return object holding the beam intensities at the experiment's HWP angle
   */
  public static CalResult buildWollastonData(WollastonExperiment experiment) {
    CalResult out = new CalResult();
    out.numerMap.put("HWP_angle", new double[]{experiment.getHwpAngle()});
    out.numerMap.put("Ordinary_beam", new double[]{experiment.getBeams().getPlus()});
    out.numerMap.put("Extraordinary_beam", new double[]{experiment.getBeams().getMinus()});
    out.numerMap.put("Total_intensity", new double[]{experiment.getTotalIntensity()});
    return out;
  }

  /**
   * Get data from an on-sky polarization experiment. A run that produced no estimate gives an
   * empty map.
   * @param experiment Experiment that has been run
   * @return object holding the Stokes vector estimate and fit residual
   */
  public static CalResult buildOnSkyData(OnSkyExperiment experiment) {
    CalResult out = new CalResult();
    if (!experiment.succeeded()) {
      return out;
    }
    out.numerMap.put("Stokes_vector", experiment.getEstimate().toArray());
    out.numerMap.put("RMS_residual", new double[]{experiment.getRmsResidual()});
    return out;
  }

  /**
   * Get data from a calibration fit. Each pass is keyed by its index; failed passes hold NaN.
   * @param experiment Experiment that has been run
   * @return object holding the per-pass and mean estimates with their percent errors
   */
  public static CalResult buildCalibrationData(CalibrationFitExperiment experiment) {
    CalResult out = new CalResult();
    List<CalibrationEstimate> estimates = experiment.getEstimates();
    double[] hwpAngles = new double[estimates.size()];
    double[] iterations = new double[estimates.size()];
    for (int i = 0; i < estimates.size(); ++i) {
      CalibrationEstimate estimate = estimates.get(i);
      hwpAngles[i] = estimate.getHwpAngle();
      iterations[i] = estimate.getIterations();
      out.numerMap.put("Pass_" + i + "_fit_parameters", estimate.getEstimates());
      out.numerMap.put("Pass_" + i + "_percent_errors", estimate.getPercentErrors());
      out.numerMap.put("Pass_" + i + "_RMS_residual", new double[]{estimate.getRmsResidual()});
    }
    out.numerMap.put("HWP_angles", hwpAngles);
    out.numerMap.put("Iterations", iterations);
    out.numerMap.put("True_parameters", experiment.getConfiguration().getTrueParameters());
    out.numerMap.put("Mean_fit_parameters", experiment.getMeanEstimate());
    out.numerMap.put("Mean_percent_errors", experiment.getMeanPercentErrors());
    return out;
  }

  /**
   * Get the map of numeric results
   * @return map of descriptions to result values
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }

}
