package asl.polarimeter.experiment;

import asl.polarimeter.input.Configuration;
import asl.polarimeter.input.MeasurementPair;
import asl.polarimeter.input.MeasurementStore;
import asl.polarimeter.input.StokesVector;
import asl.polarimeter.optics.BeamIntensities;
import asl.polarimeter.optics.InstrumentModel;
import asl.polarimeter.optics.SystemConfiguration;
import asl.polarimeter.optics.WollastonBeam;
import java.text.DecimalFormat;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Recovers the polarization of a source from dual-beam measurements. Every measurement pair
 * gives two linear equations in the Stokes parameters: the first rows of the ordinary and
 * extraordinary system matrices at that pair's HWP and parallactic angles, equal to the
 * observed I+ and I-. The stacked system is solved in the least-squares sense by SVD.
 *
 * If the stacked system does not determine the unknowns, no estimate is produced; the
 * exception explaining why is kept and can be retrieved after the run.
 */
public class OnSkyExperiment extends Experiment {

  private static final Logger logger = Logger.getLogger(OnSkyExperiment.class);

  private InstrumentModel model;
  private StokesBasis basis;
  private double singularityThreshold;

  private StokesVector estimate;
  private double rmsResidual;
  private SingularMeasurementException failure;

  public OnSkyExperiment() {
    super();
    model = InstrumentModel.IDEAL;
    basis = StokesBasis.LINEAR;
    singularityThreshold = Configuration.getInstance().getSingularityThreshold();
  }

  /**
   * Build the design matrix for a set of measurements: two rows per measurement, ordinary beam
   * first, each truncated to the unknowns of the given basis
   *
   * @param pairs Measurements to get angles from
   * @param model Instrument model giving the optical train at those angles
   * @param basis Stokes parameters being solved for
   * @return (2N x k) design matrix
   */
  static RealMatrix designMatrix(List<MeasurementPair> pairs, InstrumentModel model,
      StokesBasis basis) {
    int unknowns = basis.getUnknowns();
    double[][] rows = new double[2 * pairs.size()][];
    for (int i = 0; i < pairs.size(); ++i) {
      MeasurementPair pair = pairs.get(i);
      SystemConfiguration system =
          model.configure(pair.getHwpAngle(), pair.getParallacticAngle());
      double[] ordinary = system.intensityRow(WollastonBeam.ORDINARY);
      double[] extraordinary = system.intensityRow(WollastonBeam.EXTRAORDINARY);
      rows[2 * i] = Arrays.copyOf(ordinary, unknowns);
      rows[2 * i + 1] = Arrays.copyOf(extraordinary, unknowns);
    }
    return MatrixUtils.createRealMatrix(rows);
  }

  /**
   * Stack the observed intensities in the same order as the design matrix rows
   *
   * @param pairs Measurements to get intensities from
   * @return vector (I+_1, I-_1, I+_2, I-_2, ...)
   */
  static RealVector observations(List<MeasurementPair> pairs) {
    double[] observed = new double[2 * pairs.size()];
    for (int i = 0; i < pairs.size(); ++i) {
      observed[2 * i] = pairs.get(i).getPlus();
      observed[2 * i + 1] = pairs.get(i).getMinus();
    }
    return MatrixUtils.createRealVector(observed);
  }

  /**
   * Solve for the Stokes vector that best explains a set of measurements
   *
   * @param pairs Measurements (I+, I-, HWP angle, parallactic angle)
   * @param model Instrument model that produced the measurements
   * @param basis Which Stokes parameters to solve for
   * @param threshold Smallest ratio of smallest to largest singular value to accept
   * @return Pair of the estimated Stokes vector and the RMS residual of the fit
   * @throws SingularMeasurementException if there are fewer equations than unknowns or the
   * measurements do not constrain every unknown
   */
  public static Pair<StokesVector, Double> estimateStokes(List<MeasurementPair> pairs,
      InstrumentModel model, StokesBasis basis, double threshold)
      throws SingularMeasurementException {

    int unknowns = basis.getUnknowns();
    if (2 * pairs.size() < unknowns) {
      throw new SingularMeasurementException(pairs.size(), unknowns, 2 * pairs.size());
    }

    RealMatrix design = designMatrix(pairs, model, basis);
    RealVector observed = observations(pairs);

    SingularValueDecomposition svd = new SingularValueDecomposition(design);
    double[] singularValues = svd.getSingularValues();
    // singular values come back in descending order
    double largest = singularValues[0];
    int rank = 0;
    for (double value : singularValues) {
      if (largest > 0 && value / largest >= threshold) {
        ++rank;
      }
    }
    if (rank < unknowns) {
      throw new SingularMeasurementException(pairs.size(), unknowns, rank);
    }

    RealVector solution = svd.getSolver().solve(observed);
    RealVector residual = design.operate(solution).subtract(observed);
    double rms = Math.sqrt(residual.dotProduct(residual) / residual.getDimension());

    double[] stokes = Arrays.copyOf(solution.toArray(), StokesVector.SIZE);
    return new Pair<>(StokesVector.fromArray(stokes), rms);
  }

  @Override
  protected void backend(MeasurementStore store) {
    List<MeasurementPair> pairs = store.getMeasurements();
    estimate = null;
    rmsResidual = Double.NaN;
    failure = null;

    dataNames.add(pairs.size() + " measurement pairs");

    try {
      Pair<StokesVector, Double> result =
          estimateStokes(pairs, model, basis, singularityThreshold);
      estimate = result.getFirst();
      rmsResidual = result.getSecond();
    } catch (SingularMeasurementException e) {
      logger.error("Could not recover polarization from measurements", e);
      failure = e;
      fireStateChange("Measurements do not determine the Stokes vector");
      return;
    }

    logger.info("Recovered " + estimate + " with RMS residual " + rmsResidual);

    fireStateChange("Building observed and fitted beam series...");
    XYSeries observedPlus = new XYSeries("Observed I+");
    XYSeries observedMinus = new XYSeries("Observed I-");
    XYSeries fitPlus = new XYSeries("Fit I+");
    XYSeries fitMinus = new XYSeries("Fit I-");
    for (int i = 0; i < pairs.size(); ++i) {
      MeasurementPair pair = pairs.get(i);
      observedPlus.add(i, pair.getPlus());
      observedMinus.add(i, pair.getMinus());
      BeamIntensities fitBeams = model.configure(pair.getHwpAngle(), pair.getParallacticAngle())
          .beamIntensities(estimate);
      fitPlus.add(i, fitBeams.getPlus());
      fitMinus.add(i, fitBeams.getMinus());
    }
    XYSeriesCollection plus = new XYSeriesCollection();
    plus.addSeries(observedPlus);
    plus.addSeries(fitPlus);
    XYSeriesCollection minus = new XYSeriesCollection();
    minus.addSeries(observedMinus);
    minus.addSeries(fitMinus);
    xySeriesData.add(plus);
    xySeriesData.add(minus);
  }

  /**
   * @return estimated Stokes vector, or null if the last run failed
   */
  public StokesVector getEstimate() {
    return estimate;
  }

  public double getRmsResidual() {
    return rmsResidual;
  }

  /**
   * @return reason the last run produced no estimate, or null if it succeeded
   */
  public SingularMeasurementException getFailure() {
    return failure;
  }

  public boolean succeeded() {
    return estimate != null;
  }

  public InstrumentModel getModel() {
    return model;
  }

  public void setModel(InstrumentModel model) {
    this.model = model;
  }

  public StokesBasis getBasis() {
    return basis;
  }

  public void setBasis(StokesBasis basis) {
    this.basis = basis;
  }

  public void setSingularityThreshold(double singularityThreshold) {
    this.singularityThreshold = singularityThreshold;
  }

  @Override
  String[] getDataStrings() {
    if (estimate == null) {
      return new String[]{"No estimate: " + (failure == null ? "not run" : failure.getMessage())};
    }
    DecimalFormat df = DECIMAL_FORMAT.get();
    StringBuilder sb = new StringBuilder();
    sb.append("I: ").append(df.format(estimate.getI())).append('\n');
    sb.append("Q: ").append(df.format(estimate.getQ())).append('\n');
    sb.append("U: ").append(df.format(estimate.getU())).append('\n');
    sb.append("V: ").append(df.format(estimate.getV()));
    if (basis == StokesBasis.LINEAR) {
      sb.append(" (not solved)");
    }
    return new String[]{
        sb.toString(),
        "RMS residual: " + df.format(rmsResidual)
    };
  }

  @Override
  public int measurementsNeeded() {
    // each pair contributes two equations
    return (basis.getUnknowns() + 1) / 2;
  }

  @Override
  public boolean hasEnoughData(MeasurementStore store) {
    return store.measurementCount() > 0;
  }

}
