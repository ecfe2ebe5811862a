package asl.polarimeter.optics;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Builders for the 4x4 Mueller matrices of the elements in the polarimeter.
 * Every method here is a pure function of its parameters and produces a new matrix.
 * Angles are given in degrees and converted to radians internally.
 *
 * Sign conventions used throughout the suite: a rotation by theta turns the (Q, U)
 * reference frame by 2 * theta; the ordinary Wollaston beam passes +Q and is
 * reported as the positive (I+) channel.
 */
public class MuellerMatrices {

  /**
   * Retardance of a half-wave plate (degrees)
   */
  public static final double HALF_WAVE_RETARDANCE = 180.;

  private MuellerMatrices() {
  }

  /**
   * Rotation of the (Q, U) reference frame. Identity on I and V; any angle is valid
   * and the matrix is periodic in 180 degrees (and thus also in 360).
   * rotation(-theta) is the exact inverse of rotation(theta).
   *
   * @param theta Angle of rotation (degrees)
   * @return Rotation Mueller matrix
   */
  public static RealMatrix rotation(double theta) {
    double twoTheta = 2 * Math.toRadians(theta);
    double cos = Math.cos(twoTheta);
    double sin = Math.sin(twoTheta);
    return MatrixUtils.createRealMatrix(new double[][]{
        {1., 0., 0., 0.},
        {0., cos, sin, 0.},
        {0., -sin, cos, 0.},
        {0., 0., 0., 1.}
    });
  }

  /**
   * Turn an element defined with its axis along +Q to the given orientation:
   * rotation(-theta) * element * rotation(theta)
   *
   * @param element Mueller matrix of the element in its own frame
   * @param theta Orientation of the element's axis (degrees)
   * @return Mueller matrix of the oriented element
   */
  public static RealMatrix rotated(RealMatrix element, double theta) {
    if (theta == 0.) {
      return element.copy();
    }
    return rotation(-theta).multiply(element).multiply(rotation(theta));
  }

  /**
   * Linear retarder with its fast axis along +Q
   *
   * @param retardance Phase delay between the axes (degrees)
   * @return Retarder Mueller matrix
   */
  public static RealMatrix retarder(double retardance) {
    double phi = Math.toRadians(retardance);
    double cos = Math.cos(phi);
    double sin = Math.sin(phi);
    return MatrixUtils.createRealMatrix(new double[][]{
        {1., 0., 0., 0.},
        {0., 1., 0., 0.},
        {0., 0., cos, sin},
        {0., 0., -sin, cos}
    });
  }

  /**
   * Half-wave plate with its fast axis at the given angle. Built in closed form; equal to
   * rotated(retarder(180), theta). The matrix is symmetric and is its own inverse.
   *
   * @param theta Angle of the plate's fast axis (degrees)
   * @return Half-wave plate Mueller matrix
   */
  public static RealMatrix halfWavePlate(double theta) {
    double fourTheta = 4 * Math.toRadians(theta);
    double cos = Math.cos(fourTheta);
    double sin = Math.sin(fourTheta);
    return MatrixUtils.createRealMatrix(new double[][]{
        {1., 0., 0., 0.},
        {0., cos, sin, 0.},
        {0., sin, -cos, 0.},
        {0., 0., 0., -1.}
    });
  }

  /**
   * Generalized element with both diattenuation and retardance, axis along +Q.
   * No range checks are done on the diattenuation; values with |d| &gt; 1 produce NaN
   * entries in the retarding block, and it is up to the fitting bounds to keep d in [0, 1].
   *
   * @param diattenuation Diattenuation d, physically in [0, 1]
   * @param retardance Retardance (degrees)
   * @return Diattenuating retarder Mueller matrix
   */
  public static RealMatrix diattenuatingRetarder(double diattenuation, double retardance) {
    double phi = Math.toRadians(retardance);
    double scale = Math.sqrt(1 - diattenuation * diattenuation);
    double cos = scale * Math.cos(phi);
    double sin = scale * Math.sin(phi);
    return MatrixUtils.createRealMatrix(new double[][]{
        {1., diattenuation, 0., 0.},
        {diattenuation, 1., 0., 0.},
        {0., 0., cos, sin},
        {0., 0., -sin, cos}
    });
  }

  /**
   * Diattenuating retarder with its axis turned to the given orientation
   *
   * @param diattenuation Diattenuation d, physically in [0, 1]
   * @param retardance Retardance (degrees)
   * @param theta Orientation of the element (degrees)
   * @return Oriented diattenuating retarder Mueller matrix
   */
  public static RealMatrix diattenuatingRetarder(double diattenuation, double retardance,
      double theta) {
    return rotated(diattenuatingRetarder(diattenuation, retardance), theta);
  }

  /**
   * One output channel of a Wollaston prism with its axes along the reference frame.
   * Only the first row matters for a detector reading intensity: [0.5, +-0.5, 0, 0].
   * A rotation must be applied before this to orient the prism any other way.
   *
   * @param beam Which of the two beams to select
   * @return Rank-1 Mueller matrix of that beam
   */
  public static RealMatrix wollastonPrism(WollastonBeam beam) {
    double sign = beam.getSign();
    return MatrixUtils.createRealMatrix(new double[][]{
        {0.5, 0.5 * sign, 0., 0.},
        {0.5 * sign, 0.5, 0., 0.},
        {0., 0., 0., 0.},
        {0., 0., 0., 0.}
    });
  }

}
