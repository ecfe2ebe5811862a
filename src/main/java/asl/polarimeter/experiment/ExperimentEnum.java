package asl.polarimeter.experiment;

/**
 * Enumerated type defining each kind of experiment, so that callers have a list of all
 * experiments available and a way of creating the associated Experiment class.
 *
 * @author akearns - KBRWyle
 */
public enum ExperimentEnum {

  WOLLS("Wollaston beams") {
    @Override
    public Experiment createExperiment() {
      return new WollastonExperiment();
    }
  },
  ONSKY("On-sky polarization") {
    @Override
    public Experiment createExperiment() {
      return new OnSkyExperiment();
    }
  },
  CALFT("Derotator and mirror calibration") {
    @Override
    public Experiment createExperiment() {
      return new CalibrationFitExperiment();
    }
  };

  private final String name;

  ExperimentEnum(String name) {
    this.name = name;
  }

  public abstract Experiment createExperiment();

  public String getName() {
    return name;
  }

}
