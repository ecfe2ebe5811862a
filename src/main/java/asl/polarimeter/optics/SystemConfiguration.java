package asl.polarimeter.optics;

import asl.polarimeter.input.StokesVector;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Ordered train of optical elements ending in a Wollaston prism. The first element is the one
 * nearest the light source, so the system matrix is the product M_n * ... * M_2 * M_1.
 *
 * Order matters (matrix multiplication does not commute) but is not checked: a train built in
 * the wrong order produces numbers that are well-defined but physically meaningless.
 * A configuration is built fresh for each set of angles and is not modified afterwards.
 */
public class SystemConfiguration {

  private final List<OpticalElement> elements;

  private SystemConfiguration(List<OpticalElement> elements) {
    this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Configuration with no elements in front of the prism
   *
   * @return empty configuration
   */
  public static SystemConfiguration prismOnly() {
    return new SystemConfiguration(Collections.emptyList());
  }

  /**
   * Compose all element matrices, source side first
   *
   * @return System Mueller matrix (not including the prism)
   */
  public RealMatrix evaluate() {
    RealMatrix system = MatrixUtils.createRealIdentityMatrix(StokesVector.SIZE);
    for (OpticalElement element : elements) {
      system = element.getMatrix().multiply(system);
    }
    return system;
  }

  /**
   * Compose the system and terminate it with the given beam of the prism
   *
   * @param beam Wollaston channel to evaluate
   * @return Mueller matrix from the source to that channel
   */
  public RealMatrix evaluate(WollastonBeam beam) {
    return MuellerMatrices.wollastonPrism(beam).multiply(evaluate());
  }

  /**
   * Get the first row of the matrix for a channel, i.e., the linear function taking a Stokes
   * vector to that channel's intensity. These are the rows of the estimator's design matrix.
   *
   * @param beam Wollaston channel to evaluate
   * @return Coefficients on (I, Q, U, V)
   */
  public double[] intensityRow(WollastonBeam beam) {
    return evaluate(beam).getRow(0);
  }

  /**
   * Apply the system (without the prism) to an input state
   *
   * @param stokes Input polarization state
   * @return State at the prism
   */
  public StokesVector apply(StokesVector stokes) {
    RealVector out = evaluate().operate(stokes.toRealVector());
    return StokesVector.fromArray(out.toArray());
  }

  /**
   * Total intensity reaching the prism, without splitting into channels
   *
   * @param stokes Input polarization state
   * @return First component of the system matrix applied to the state
   */
  public double totalIntensity(StokesVector stokes) {
    return apply(stokes).getI();
  }

  /**
   * Intensities of both prism channels for the given input state
   *
   * @param stokes Input polarization state
   * @return (I+, I-) pair
   */
  public BeamIntensities beamIntensities(StokesVector stokes) {
    RealMatrix system = evaluate();
    RealVector atPrism = system.operate(stokes.toRealVector());
    double plus = MuellerMatrices.wollastonPrism(WollastonBeam.ORDINARY).operate(atPrism)
        .getEntry(0);
    double minus = MuellerMatrices.wollastonPrism(WollastonBeam.EXTRAORDINARY).operate(atPrism)
        .getEntry(0);
    return new BeamIntensities(plus, minus);
  }

  public List<OpticalElement> getElements() {
    return elements;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (OpticalElement element : elements) {
      sb.append(element).append(" -> ");
    }
    return sb.append("Wollaston prism").toString();
  }

  /**
   * Builder adding elements in the order light passes through them
   */
  public static class Builder {

    private final List<OpticalElement> elements = new ArrayList<>();

    private Builder() {
    }

    public Builder add(OpticalElement element) {
      elements.add(element);
      return this;
    }

    public Builder rotation(double angle) {
      return add(OpticalElement.rotation(angle));
    }

    public Builder halfWavePlate(double angle) {
      return add(OpticalElement.halfWavePlate(angle));
    }

    public Builder retarder(double retardance, double angle) {
      return add(OpticalElement.retarder(retardance, angle));
    }

    public Builder diattenuatingRetarder(String name, double diattenuation, double retardance,
        double angle) {
      return add(OpticalElement.diattenuatingRetarder(name, diattenuation, retardance, angle));
    }

    public SystemConfiguration build() {
      return new SystemConfiguration(elements);
    }
  }

}
