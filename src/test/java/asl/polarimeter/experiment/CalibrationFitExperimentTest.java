package asl.polarimeter.experiment;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import asl.polarimeter.input.CalibrationConfiguration;
import asl.polarimeter.input.MeasurementStore;
import java.util.List;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.jfree.data.xy.XYSeriesCollection;
import org.junit.Test;

public class CalibrationFitExperimentTest {

  private static CalibrationFitExperiment runWith(CalibrationConfiguration config) {
    CalibrationFitExperiment experiment = new CalibrationFitExperiment();
    experiment.setConfiguration(config);
    experiment.runExperimentOnData(new MeasurementStore());
    return experiment;
  }

  @Test
  public void noiselessFit_recoversAllParametersAtEveryHwpAngle() {
    CalibrationConfiguration config = CalibrationConfiguration.builder()
        .signalToNoise(Double.POSITIVE_INFINITY)
        .build();
    CalibrationFitExperiment experiment = runWith(config);

    List<CalibrationEstimate> estimates = experiment.getEstimates();
    assertEquals(4, estimates.size());
    for (CalibrationEstimate estimate : estimates) {
      assertTrue(estimate.toString(), estimate.isConverged());
      for (double error : estimate.getPercentErrors()) {
        assertTrue(estimate.toString(), error < 0.01);
      }
      assertTrue(estimate.getIterations() > 0);
      assertEquals(0., estimate.getRmsResidual(), 1E-8);
    }
    for (double error : experiment.getMeanPercentErrors()) {
      assertTrue(error < 0.01);
    }
    assertEquals(0, experiment.getFailedPassCount());
  }

  @Test
  public void errorDoesNotIncreaseWithSignalToNoise() {
    double[] ratios = {1E3, 1E4, 1E6, 1E8};
    long[] seeds = {2718L, 31L, 577L, 1618L, 4242L};
    double previous = Double.POSITIVE_INFINITY;
    for (double snr : ratios) {
      // passes at low SNR may hit the iteration limit; average what converged
      double sum = 0.;
      int runs = 0;
      for (long seed : seeds) {
        CalibrationConfiguration config = CalibrationConfiguration.builder()
            .signalToNoise(snr)
            .seed(seed)
            .build();
        CalibrationFitExperiment experiment = runWith(config);
        assertEquals(4, experiment.getEstimates().size());
        double error = experiment.getAveragePercentError();
        if (!Double.isNaN(error)) {
          sum += error;
          ++runs;
        }
      }
      assertTrue("No run converged at SNR " + snr, runs > 0);
      double meanError = sum / runs;
      assertTrue("SNR " + snr + " gave " + meanError + "% vs. " + previous + "%",
          meanError <= previous);
      previous = meanError;
    }
  }

  @Test
  public void highSignalToNoise_everyPassConverges() {
    CalibrationConfiguration config = CalibrationConfiguration.builder()
        .signalToNoise(1E7)
        .seed(2718L)
        .build();
    CalibrationFitExperiment experiment = runWith(config);
    assertEquals(0, experiment.getFailedPassCount());
    assertTrue(experiment.getAveragePercentError() < 1.);
  }

  @Test
  public void sameSeedGivesIdenticalResults() {
    CalibrationConfiguration config = CalibrationConfiguration.builder()
        .signalToNoise(1E6)
        .seed(99L)
        .hwpAngles(22.5)
        .build();
    double[] first = runWith(config).getEstimates().get(0).getEstimates();
    double[] second = runWith(config).getEstimates().get(0).getEstimates();
    assertArrayEquals(first, second, 0.);
  }

  @Test
  public void addNoise_deterministicBySeed() {
    double[] clean = {0.5, 0.25, -0.1, 0.};
    double[] a = CalibrationFitExperiment.addNoise(clean, 100., 5L);
    double[] b = CalibrationFitExperiment.addNoise(clean, 100., 5L);
    double[] c = CalibrationFitExperiment.addNoise(clean, 100., 6L);
    assertArrayEquals(a, b, 0.);
    assertFalse(a[0] == c[0]);
    // zero intensity has zero noise
    assertEquals(0., a[3], 0.);
  }

  @Test
  public void addNoise_infiniteSnrIsNoiseless() {
    double[] clean = {0.5, 0.25};
    assertArrayEquals(clean,
        CalibrationFitExperiment.addNoise(clean, Double.POSITIVE_INFINITY, 1L), 0.);
  }

  @Test
  public void iterationLimit_reportsEveryPassAsFailed() {
    CalibrationConfiguration config = CalibrationConfiguration.builder()
        .maxIterations(1)
        .build();
    CalibrationFitExperiment experiment = runWith(config);

    assertEquals(4, experiment.getEstimates().size());
    assertEquals(4, experiment.getFailedPassCount());
    for (CalibrationEstimate estimate : experiment.getEstimates()) {
      assertFalse(estimate.isConverged());
      FitNonConvergenceException failure = estimate.getFailure();
      assertNotNull(failure);
      assertTrue(failure.getCause() instanceof MathIllegalStateException);
      assertEquals(estimate.getHwpAngle(), failure.getHwpAngle(), 0.);
      assertTrue(Double.isNaN(estimate.getEstimates()[0]));
    }
    assertTrue(Double.isNaN(experiment.getMeanEstimate()[0]));
    assertTrue(Double.isNaN(experiment.getAveragePercentError()));
  }

  @Test
  public void planObservations_everyStarAtEveryHourAngle() {
    CalibrationConfiguration config = CalibrationConfiguration.builder().build();
    List<CalibrationFitExperiment.Observation> observations =
        CalibrationFitExperiment.planObservations(config, 45.);
    assertEquals(9, observations.size());
    // position angle follows the HWP angle: 2 * 45 puts all polarization in U
    assertEquals(0., observations.get(0).stokes.getQ(), 1E-15);
    assertEquals(0.0061, observations.get(0).stokes.getU(), 1E-15);
    // hour angle -45 is east of the meridian
    assertTrue(observations.get(0).parallacticAngle < 0);
    assertTrue(observations.get(2).parallacticAngle > 0);
  }

  @Test
  public void jacobian_matchesEvaluationAndStaysInBounds() {
    CalibrationConfiguration config = CalibrationConfiguration.builder().build();
    List<CalibrationFitExperiment.Observation> observations =
        CalibrationFitExperiment.planObservations(config, 0.);
    double[] atBound = {1., 186.6, 0.9761, 359.9999999999};
    Pair<RealVector, RealMatrix> result = CalibrationFitExperiment.jacobian(
        MatrixUtils.createRealVector(atBound), observations, 0.);
    assertArrayEquals(CalibrationFitExperiment.predictIntensities(atBound, observations, 0.),
        result.getFirst().toArray(), 0.);
    for (int i = 0; i < result.getSecond().getRowDimension(); ++i) {
      for (int j = 0; j < result.getSecond().getColumnDimension(); ++j) {
        assertFalse(Double.isNaN(result.getSecond().getEntry(i, j)));
      }
    }
  }

  @Test
  public void percentErrorSeries_onePointPerConvergedPass() {
    CalibrationFitExperiment experiment =
        runWith(CalibrationConfiguration.builder().hwpAngles(0., 45.).build());
    XYSeriesCollection errors = experiment.getData().get(0);
    assertEquals(4, errors.getSeriesCount());
    assertEquals(2, errors.getSeries(0).getItemCount());
    assertEquals(3, experiment.getInputNames().size());
    assertTrue(experiment.getReportString().contains("Mean over converged passes"));
  }

}
