package asl.polarimeter.input;

import java.util.Arrays;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealVector;

/**
 * Immutable polarization state (I, Q, U, V). No physical constraints are enforced:
 * any four real numbers are accepted, since callers and estimators may produce
 * states with |Q|, |U| or |V| larger than I.
 */
public class StokesVector {

  public static final int SIZE = 4;

  private final double[] components;

  public StokesVector(double i, double q, double u, double v) {
    components = new double[]{i, q, u, v};
  }

  /**
   * Create a Stokes vector from an array of (I, Q, U, V)
   *
   * @param values Array of exactly four values
   * @return new Stokes vector
   */
  public static StokesVector fromArray(double[] values) {
    if (values.length != SIZE) {
      throw new IllegalArgumentException("Stokes vector needs 4 parameters, got " + values.length);
    }
    return new StokesVector(values[0], values[1], values[2], values[3]);
  }

  /**
   * Stokes vector of light with total intensity 1 and linear polarization fraction p
   * at position angle pa: (1, p cos 2pa, p sin 2pa, 0)
   *
   * @param polarizationFraction Degree of linear polarization (0 to 1)
   * @param positionAngle Position angle of polarization (degrees)
   * @return new Stokes vector
   */
  public static StokesVector fromLinearPolarization(double polarizationFraction,
      double positionAngle) {
    double twoPA = 2 * Math.toRadians(positionAngle);
    return new StokesVector(1., polarizationFraction * Math.cos(twoPA),
        polarizationFraction * Math.sin(twoPA), 0.);
  }

  public double getI() {
    return components[0];
  }

  public double getQ() {
    return components[1];
  }

  public double getU() {
    return components[2];
  }

  public double getV() {
    return components[3];
  }

  /**
   * @return Copy of the components as (I, Q, U, V)
   */
  public double[] toArray() {
    return components.clone();
  }

  public RealVector toRealVector() {
    return MatrixUtils.createRealVector(components);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StokesVector)) {
      return false;
    }
    return Arrays.equals(components, ((StokesVector) o).components);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(components);
  }

  @Override
  public String toString() {
    return "[I=" + getI() + ", Q=" + getQ() + ", U=" + getU() + ", V=" + getV() + "]";
  }

}
