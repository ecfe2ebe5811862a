package asl.polarimeter.optics;

/**
 * Diattenuation and retardance of one diattenuating retarder (derotator or tertiary mirror)
 */
public class RetarderParameters {

  public static final double MIN_DIATTENUATION = 0.;
  public static final double MAX_DIATTENUATION = 1.;
  public static final double MIN_RETARDANCE = 0.;
  /**
   * Exclusive upper bound on retardance
   */
  public static final double MAX_RETARDANCE = 360.;

  private final double diattenuation;
  private final double retardance;

  public RetarderParameters(double diattenuation, double retardance) {
    this.diattenuation = diattenuation;
    this.retardance = retardance;
  }

  public double getDiattenuation() {
    return diattenuation;
  }

  /**
   * @return retardance in degrees
   */
  public double getRetardance() {
    return retardance;
  }

  /**
   * Check the parameters against the box the fitter searches in:
   * diattenuation in [0, 1], retardance in [0, 360)
   *
   * @return True if both parameters are inside the bounds
   */
  public boolean isWithinBounds() {
    return diattenuation >= MIN_DIATTENUATION && diattenuation <= MAX_DIATTENUATION
        && retardance >= MIN_RETARDANCE && retardance < MAX_RETARDANCE;
  }

  @Override
  public String toString() {
    return "(d=" + diattenuation + ", r=" + retardance + ")";
  }

}
