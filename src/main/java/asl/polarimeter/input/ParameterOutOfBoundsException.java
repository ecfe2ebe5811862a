package asl.polarimeter.input;

/**
 * Thrown when a retarder parameter handed to the calibration fit lies outside the region the
 * solver searches, i.e., diattenuation outside [0, 1] or retardance outside [0, 360).
 */
public class ParameterOutOfBoundsException extends IllegalArgumentException {

  private static final long serialVersionUID = -2207316054731289370L;

  private final String parameterName;
  private final double value;

  public ParameterOutOfBoundsException(String parameterName, double value) {
    super(parameterName + " is out of bounds: " + value);
    this.parameterName = parameterName;
    this.value = value;
  }

  public String getParameterName() {
    return parameterName;
  }

  public double getValue() {
    return value;
  }

}
