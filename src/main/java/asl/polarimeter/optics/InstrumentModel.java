package asl.polarimeter.optics;

/**
 * Produces the optical train for one measurement, given the two angles that change between
 * measurements. Both estimators work from the same {@link SystemConfiguration} type; what
 * differs between them is which elements a model puts in front of the prism.
 */
@FunctionalInterface
public interface InstrumentModel {

  String DEROTATOR = "Derotator";
  String TERTIARY_MIRROR = "Tertiary mirror";

  /**
   * The derotator turns at half the rate of the field it compensates
   */
  double DEROTATOR_TRACKING_RATE = 0.5;

  /**
   * Parallactic rotation followed by the half-wave plate, with no other polarizing optics.
   * Circular polarization never reaches the prism through this train.
   */
  InstrumentModel IDEAL = (hwpAngle, parallacticAngle) -> SystemConfiguration.builder()
      .rotation(parallacticAngle)
      .halfWavePlate(hwpAngle)
      .build();

  /**
   * Build the optical train for a measurement
   *
   * @param hwpAngle Half-wave plate angle (degrees)
   * @param parallacticAngle Parallactic angle (degrees)
   * @return configuration from the sky to the prism
   */
  SystemConfiguration configure(double hwpAngle, double parallacticAngle);

  /**
   * Full instrument train: parallactic rotation, tertiary mirror, half-wave plate, derotator.
   * The mirror is oriented by the telescope altitude, and the derotator tracks half the
   * parallactic angle.
   *
   * @param hwpAngle Half-wave plate angle (degrees)
   * @param parallacticAngle Parallactic angle (degrees)
   * @param mirrorAngle Orientation of the tertiary mirror (degrees), i.e., the altitude
   * @param mirror Tertiary mirror diattenuation and retardance
   * @param derotator Derotator diattenuation and retardance
   * @return configuration from the sky to the prism
   */
  static SystemConfiguration instrumentTrain(double hwpAngle, double parallacticAngle,
      double mirrorAngle, RetarderParameters mirror, RetarderParameters derotator) {
    return SystemConfiguration.builder()
        .rotation(parallacticAngle)
        .diattenuatingRetarder(TERTIARY_MIRROR, mirror.getDiattenuation(),
            mirror.getRetardance(), mirrorAngle)
        .halfWavePlate(hwpAngle)
        .diattenuatingRetarder(DEROTATOR, derotator.getDiattenuation(),
            derotator.getRetardance(), DEROTATOR_TRACKING_RATE * parallacticAngle)
        .build();
  }

  /**
   * Instrument model with known retarders and the mirror held at a fixed orientation, for
   * recovering on-sky polarization (including circular) through the full instrument
   *
   * @param mirror Tertiary mirror diattenuation and retardance
   * @param mirrorAngle Fixed orientation of the mirror (degrees)
   * @param derotator Derotator diattenuation and retardance
   * @return model producing the full train for each measurement
   */
  static InstrumentModel withRetarders(RetarderParameters mirror, double mirrorAngle,
      RetarderParameters derotator) {
    return (hwpAngle, parallacticAngle) ->
        instrumentTrain(hwpAngle, parallacticAngle, mirrorAngle, mirror, derotator);
  }

}
