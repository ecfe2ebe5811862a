package asl.polarimeter.experiment;

/**
 * Which Stokes parameters the on-sky estimator solves for. Circular polarization passes through
 * an ideal half-wave plate and prism without reaching either beam, so it is only solvable when
 * the instrument model has retarders ahead of the plate that convert some of it to linear.
 */
public enum StokesBasis {

  /**
   * Solve for I, Q and U; V is reported as zero
   */
  LINEAR(3),
  /**
   * Solve for I, Q, U and V
   */
  FULL(4);

  private final int unknowns;

  StokesBasis(int unknowns) {
    this.unknowns = unknowns;
  }

  public int getUnknowns() {
    return unknowns;
  }

}
