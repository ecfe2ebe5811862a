package asl.polarimeter.experiment;

/**
 * Records that the calibration solver gave up on a pass (iteration or evaluation limit reached,
 * or no progress possible). It is attached to the pass's estimate rather than thrown out of the
 * experiment, so that the other passes are still reported.
 */
public class FitNonConvergenceException extends Exception {

  private static final long serialVersionUID = -4411916284957735317L;

  private final double hwpAngle;

  FitNonConvergenceException(double hwpAngle, Throwable cause) {
    super("Calibration fit at HWP angle " + hwpAngle + " did not converge: "
        + cause.getMessage(), cause);
    this.hwpAngle = hwpAngle;
  }

  public double getHwpAngle() {
    return hwpAngle;
  }

}
