package asl.polarimeter;

import asl.polarimeter.experiment.CalibrationFitExperiment;
import asl.polarimeter.experiment.ExperimentEnum;
import asl.polarimeter.input.CalibrationConfiguration;
import asl.polarimeter.input.Configuration;
import asl.polarimeter.input.MeasurementStore;
import asl.polarimeter.output.CalResult;
import org.apache.log4j.Logger;

/**
 * Runs the derotator and mirror calibration fit in batch and prints its report.
 * Usage: CalibrationShell [signal-to-noise] [config file]
 */
public class CalibrationShell {

  private static final Logger logger = Logger.getLogger(CalibrationShell.class);

  private final CalibrationFitExperiment experiment;

  public CalibrationShell() {
    experiment = (CalibrationFitExperiment) ExperimentEnum.CALFT.createExperiment();
  }

  /**
   * Simulate observations and run the calibration fit over them
   * @param configuration Calibration settings to run with
   * @return results of the fit, keyed by description
   */
  public CalResult run(CalibrationConfiguration configuration) {
    experiment.setConfiguration(configuration);
    experiment.addChangeListener(e -> logger.info(experiment.getStatus()));
    experiment.runExperimentOnData(new MeasurementStore());
    return CalResult.buildCalibrationData(experiment);
  }

  /**
   * Return the experiment the fit is run with.
   * This should not be called until run(..) has been.
   * @return calibration experiment, to enable reading the results
   */
  public CalibrationFitExperiment getExperiment() {
    return experiment;
  }

  public static void main(String[] args) {
    Configuration config = args.length > 1 ?
        Configuration.getInstance(args[1]) : Configuration.getInstance();
    CalibrationConfiguration.Builder builder = CalibrationConfiguration.builder(config);
    if (args.length > 0) {
      try {
        builder.signalToNoise(Double.parseDouble(args[0]));
      } catch (NumberFormatException e) {
        logger.error("Signal-to-noise must be a number, got " + args[0]);
        System.exit(1);
      }
    }
    CalibrationShell shell = new CalibrationShell();
    shell.run(builder.build());
    System.out.println(shell.getExperiment().getReportString());
  }

}
