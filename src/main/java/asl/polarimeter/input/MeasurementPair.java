package asl.polarimeter.input;

import asl.polarimeter.optics.BeamIntensities;

/**
 * Simultaneous readings of both Wollaston channels along with the half-wave plate angle and
 * parallactic angle they were taken at. Angles are in degrees.
 */
public class MeasurementPair {

  private final double plus;
  private final double minus;
  private final double hwpAngle;
  private final double parallacticAngle;

  public MeasurementPair(double plus, double minus, double hwpAngle, double parallacticAngle) {
    this.plus = plus;
    this.minus = minus;
    this.hwpAngle = hwpAngle;
    this.parallacticAngle = parallacticAngle;
  }

  public MeasurementPair(BeamIntensities beams, double hwpAngle, double parallacticAngle) {
    this(beams.getPlus(), beams.getMinus(), hwpAngle, parallacticAngle);
  }

  /**
   * Create a measurement from an array in column order:
   * (positive beam, negative beam, HWP angle, parallactic angle)
   *
   * @param values Array of four values
   * @return new measurement
   */
  public static MeasurementPair fromArray(double[] values) {
    if (values.length != 4) {
      throw new IllegalArgumentException(
          "Measurement needs I+, I-, HWP angle and parallactic angle, got "
              + values.length + " values");
    }
    return new MeasurementPair(values[0], values[1], values[2], values[3]);
  }

  public double getPlus() {
    return plus;
  }

  public double getMinus() {
    return minus;
  }

  public BeamIntensities getBeams() {
    return new BeamIntensities(plus, minus);
  }

  public double getHwpAngle() {
    return hwpAngle;
  }

  public double getParallacticAngle() {
    return parallacticAngle;
  }

  @Override
  public String toString() {
    return "I+=" + plus + ", I-=" + minus + " @ HWP " + hwpAngle + ", PA " + parallacticAngle;
  }

}
