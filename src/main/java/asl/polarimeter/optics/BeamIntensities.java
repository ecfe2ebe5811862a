package asl.polarimeter.optics;

/**
 * Intensities read out simultaneously on the two Wollaston channels
 */
public class BeamIntensities {

  private final double plus;
  private final double minus;

  public BeamIntensities(double plus, double minus) {
    this.plus = plus;
    this.minus = minus;
  }

  /**
   * @return Intensity of the ordinary (positive) beam
   */
  public double getPlus() {
    return plus;
  }

  /**
   * @return Intensity of the extraordinary (negative) beam
   */
  public double getMinus() {
    return minus;
  }

  /**
   * Get the intensity on a channel by its beam
   *
   * @param beam Beam to get
   * @return I+ for the ordinary beam, I- for the extraordinary beam
   */
  public double get(WollastonBeam beam) {
    return beam == WollastonBeam.ORDINARY ? plus : minus;
  }

  /**
   * @return I+ + I-, the total intensity reaching the prism
   */
  public double sum() {
    return plus + minus;
  }

  /**
   * @return I+ - I-, the polarized signal the prism measures
   */
  public double difference() {
    return plus - minus;
  }

  @Override
  public String toString() {
    return "(" + plus + ", " + minus + ")";
  }

}
