package asl.polarimeter.input;

import asl.polarimeter.utils.ObservingGeometry;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Polarized standard star used as a calibration source: name, J2000 coordinates and the
 * fraction of its light that is linearly polarized.
 */
public class StandardStar {

  /**
   * Standards used when no catalog is given
   */
  public static final List<StandardStar> DEFAULT_CATALOG = Collections.unmodifiableList(
      Arrays.asList(
          new StandardStar("HDE 279652", 4, 14, 50.2, 37, 35, 54., 0.0061),
          new StandardStar("HDE 279658", 4, 13, 47.3, 37, 9, 32., 0.0142),
          new StandardStar("HDE 283637", 4, 22, 53.3, 27, 30, 18., 0.0157)
      ));

  private final String name;
  private final double raHours;
  private final double raMinutes;
  private final double raSeconds;
  private final double decDegrees;
  private final double decArcminutes;
  private final double decArcseconds;
  private final double polarizationFraction;

  public StandardStar(String name, double raHours, double raMinutes, double raSeconds,
      double decDegrees, double decArcminutes, double decArcseconds,
      double polarizationFraction) {
    this.name = name;
    this.raHours = raHours;
    this.raMinutes = raMinutes;
    this.raSeconds = raSeconds;
    this.decDegrees = decDegrees;
    this.decArcminutes = decArcminutes;
    this.decArcseconds = decArcseconds;
    this.polarizationFraction = polarizationFraction;
  }

  public String getName() {
    return name;
  }

  /**
   * @return right ascension converted to degrees
   */
  public double getRaDegrees() {
    return ObservingGeometry.hoursToDegrees(raHours, raMinutes, raSeconds);
  }

  /**
   * @return declination converted to decimal degrees
   */
  public double getDecDegrees() {
    return ObservingGeometry.dmsToDegrees(decDegrees, decArcminutes, decArcseconds);
  }

  public double getPolarizationFraction() {
    return polarizationFraction;
  }

  /**
   * Stokes vector of this star with its polarization at the given position angle
   * @param positionAngle position angle of polarization (degrees)
   * @return unit-intensity Stokes vector
   */
  public StokesVector getStokes(double positionAngle) {
    return StokesVector.fromLinearPolarization(polarizationFraction, positionAngle);
  }

  @Override
  public String toString() {
    return name + " (p=" + polarizationFraction + ")";
  }

}
