package asl.polarimeter.experiment;

/**
 * Thrown when a set of measurements cannot determine the requested Stokes parameters, because
 * there are too few of them or because they repeat the same optical configuration.
 */
public class SingularMeasurementException extends Exception {

  private static final long serialVersionUID = 6305426614125541082L;

  private final int measurementCount;
  private final int unknowns;
  private final int rank;

  SingularMeasurementException(int measurementCount, int unknowns, int rank) {
    super("Measurements are rank-deficient: " + measurementCount + " pair(s) give rank "
        + rank + " but " + unknowns + " Stokes parameters are unknown");
    this.measurementCount = measurementCount;
    this.unknowns = unknowns;
    this.rank = rank;
  }

  public int getMeasurementCount() {
    return measurementCount;
  }

  public int getUnknowns() {
    return unknowns;
  }

  public int getRank() {
    return rank;
  }

}
