package asl.polarimeter.optics;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * A single element in the optical train, described by its kind and the scalar parameters
 * that kind uses. Elements are immutable; a new one is made for each configuration.
 * The Wollaston prism is not an element here, since it terminates the train and produces
 * intensities rather than a Stokes vector (see {@link SystemConfiguration#evaluate(WollastonBeam)}).
 */
public class OpticalElement {

  /**
   * Kinds of element the model knows how to build. The list is closed: composing a system
   * only needs to turn each of these into a matrix.
   */
  public enum ElementType {
    ROTATION("Rotator"),
    HALF_WAVE_PLATE("Half-wave plate"),
    RETARDER("Retarder"),
    DIATTENUATING_RETARDER("Diattenuating retarder");

    private final String name;

    ElementType(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }
  }

  private final ElementType type;
  private final String name;
  private final double angle;
  private final double diattenuation;
  private final double retardance;

  private OpticalElement(ElementType type, String name, double angle, double diattenuation,
      double retardance) {
    this.type = type;
    this.name = name;
    this.angle = angle;
    this.diattenuation = diattenuation;
    this.retardance = retardance;
  }

  /**
   * Frame rotation, e.g., the stage compensating for parallactic rotation
   *
   * @param angle Rotation angle (degrees)
   * @return new element
   */
  public static OpticalElement rotation(double angle) {
    return new OpticalElement(ElementType.ROTATION, ElementType.ROTATION.getName(), angle, 0., 0.);
  }

  /**
   * Half-wave plate at the given angle
   *
   * @param angle Fast-axis angle (degrees)
   * @return new element
   */
  public static OpticalElement halfWavePlate(double angle) {
    return new OpticalElement(ElementType.HALF_WAVE_PLATE, ElementType.HALF_WAVE_PLATE.getName(),
        angle, 0., MuellerMatrices.HALF_WAVE_RETARDANCE);
  }

  /**
   * Pure linear retarder at the given angle
   *
   * @param retardance Retardance (degrees)
   * @param angle Fast-axis angle (degrees)
   * @return new element
   */
  public static OpticalElement retarder(double retardance, double angle) {
    return new OpticalElement(ElementType.RETARDER, ElementType.RETARDER.getName(), angle, 0.,
        retardance);
  }

  /**
   * Named diattenuating retarder, such as the derotator or the tertiary mirror
   *
   * @param name Name used to identify the element in reports
   * @param diattenuation Diattenuation
   * @param retardance Retardance (degrees)
   * @param angle Orientation of the element (degrees)
   * @return new element
   */
  public static OpticalElement diattenuatingRetarder(String name, double diattenuation,
      double retardance, double angle) {
    return new OpticalElement(ElementType.DIATTENUATING_RETARDER, name, angle, diattenuation,
        retardance);
  }

  /**
   * Build the Mueller matrix for this element from its parameters
   *
   * @return new 4x4 matrix
   */
  public RealMatrix getMatrix() {
    switch (type) {
      case ROTATION:
        return MuellerMatrices.rotation(angle);
      case HALF_WAVE_PLATE:
        return MuellerMatrices.halfWavePlate(angle);
      case RETARDER:
        return MuellerMatrices.rotated(MuellerMatrices.retarder(retardance), angle);
      case DIATTENUATING_RETARDER:
        return MuellerMatrices.diattenuatingRetarder(diattenuation, retardance, angle);
      default:
        throw new IllegalArgumentException("Invalid element type specified: " + type);
    }
  }

  public ElementType getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  /**
   * @return Rotation, fast-axis or orientation angle of this element (degrees)
   */
  public double getAngle() {
    return angle;
  }

  public double getDiattenuation() {
    return diattenuation;
  }

  /**
   * @return Retardance (degrees), 180 for a half-wave plate and 0 for a rotation
   */
  public double getRetardance() {
    return retardance;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name).append(" [angle ").append(angle);
    if (type == ElementType.DIATTENUATING_RETARDER) {
      sb.append(", diattenuation ").append(diattenuation);
    }
    if (type == ElementType.DIATTENUATING_RETARDER || type == ElementType.RETARDER) {
      sb.append(", retardance ").append(retardance);
    }
    return sb.append(']').toString();
  }

}
