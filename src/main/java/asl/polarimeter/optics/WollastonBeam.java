package asl.polarimeter.optics;

/**
 * The two orthogonally polarized outputs of the Wollaston prism.
 * The ordinary beam is the positive (I+) channel, passing +Q.
 */
public enum WollastonBeam {

  ORDINARY("o", 1),
  EXTRAORDINARY("e", -1);

  private final String label;
  private final int sign;

  WollastonBeam(String label, int sign) {
    this.label = label;
    this.sign = sign;
  }

  public String getLabel() {
    return label;
  }

  /**
   * @return +1 for the ordinary beam, -1 for the extraordinary beam
   */
  public int getSign() {
    return sign;
  }

}
