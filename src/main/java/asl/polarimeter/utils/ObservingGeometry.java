package asl.polarimeter.utils;

/**
 * Closed-form conversions between hour angle / declination and the angles the
 * polarimeter model needs: parallactic angle (sky rotation compensated by the
 * rotator stage) and altitude (orientation of the tertiary mirror).
 * Everything here takes and returns degrees.
 *
 * Hour angles are supplied by whatever is tracking the target; no ephemeris
 * lookup is done here.
 */
public class ObservingGeometry {

  /**
   * Latitude of the W. M. Keck Observatory, degrees north
   */
  public static final double KECK_LATITUDE = 19.8260;

  /**
   * Parallactic angle of a target, measured from north towards east
   *
   * @param hourAngle Hour angle of the target (degrees, positive west of meridian)
   * @param declination Declination of the target (degrees)
   * @param latitude Latitude of the observatory (degrees)
   * @return Parallactic angle in degrees, between -180 and 180
   */
  public static double parallacticAngle(double hourAngle, double declination, double latitude) {
    double h = Math.toRadians(hourAngle);
    double dec = Math.toRadians(declination);
    double lat = Math.toRadians(latitude);
    double numerator = Math.sin(h);
    double denominator = Math.cos(dec) * Math.tan(lat) - Math.sin(dec) * Math.cos(h);
    return Math.toDegrees(Math.atan2(numerator, denominator));
  }

  /**
   * Altitude of a target above the horizon
   *
   * @param hourAngle Hour angle of the target (degrees)
   * @param declination Declination of the target (degrees)
   * @param latitude Latitude of the observatory (degrees)
   * @return Altitude in degrees, negative when below the horizon
   */
  public static double altitude(double hourAngle, double declination, double latitude) {
    double h = Math.toRadians(hourAngle);
    double dec = Math.toRadians(declination);
    double lat = Math.toRadians(latitude);
    double sinAlt = Math.sin(lat) * Math.sin(dec) + Math.cos(lat) * Math.cos(dec) * Math.cos(h);
    return Math.toDegrees(Math.asin(sinAlt));
  }

  /**
   * Convert a sexagesimal right ascension to degrees (15 degrees per hour)
   *
   * @param hours Hours
   * @param minutes Minutes of time
   * @param seconds Seconds of time
   * @return Angle in degrees
   */
  public static double hoursToDegrees(double hours, double minutes, double seconds) {
    return 15. * (hours + minutes / 60. + seconds / 3600.);
  }

  /**
   * Convert a sexagesimal declination to degrees. The sign of the degree term
   * applies to the whole value, so (-27, 30, 0) is -27.5.
   *
   * @param degrees Whole degrees, carrying the sign
   * @param arcminutes Arcminutes
   * @param arcseconds Arcseconds
   * @return Angle in degrees
   */
  public static double dmsToDegrees(double degrees, double arcminutes, double arcseconds) {
    double magnitude = Math.abs(degrees) + arcminutes / 60. + arcseconds / 3600.;
    // Double.compare keeps the sign of a negative zero ("-00 30 00")
    return Double.compare(degrees, 0.) < 0 ? -magnitude : magnitude;
  }

}
