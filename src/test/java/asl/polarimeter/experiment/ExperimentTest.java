package asl.polarimeter.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.polarimeter.input.MeasurementStore;
import org.junit.Test;

public class ExperimentTest {

  @Test
  public void experiment_constructorInitializes() {
    Experiment experiment = new MockExperiment();
    assertTrue(experiment.getInputNames().isEmpty());
    assertTrue(experiment.getData().isEmpty());
    assertEquals("", experiment.getStatus());
  }

  @Test
  public void fireStateChange_updatesStatus() {
    MockExperiment experiment = new MockExperiment();
    experiment.fireStateChange("Fired Status Change");
    assertEquals("Fired Status Change", experiment.getStatus());
    assertEquals(1, experiment.numberOfChangesFired);
  }

  @Test
  public void runExperimentOnData_checksDataThenCallsBackend() {
    MockExperiment experiment = new MockExperiment();
    experiment.runExperimentOnData(new MeasurementStore());

    assertTrue(experiment.hasEnoughDataCalled);
    assertTrue(experiment.backendCalled);
    assertEquals(3, experiment.numberOfChangesFired);
    assertEquals("Calculations done!", experiment.getStatus());
  }

  @Test
  public void runExperimentOnData_reinitializesFields() {
    Experiment experiment = new MockExperiment();
    experiment.dataNames.add("Not Empty");
    experiment.runExperimentOnData(new MeasurementStore());
    assertTrue(experiment.getInputNames().isEmpty());
  }

  @Test
  public void runExperimentOnData_notEnoughDataThrows() {
    MockExperiment experiment = new MockExperiment();
    experiment.setHasEnoughData = false;
    try {
      experiment.runExperimentOnData(new MeasurementStore());
      fail("Expected experiment to refuse to run without data");
    } catch (IllegalArgumentException e) {
      assertFalse(experiment.backendCalled);
    }
  }

  @Test
  public void removeChangeListener_stopsNotifications() {
    MockExperiment experiment = new MockExperiment();
    int[] count = {0};
    javax.swing.event.ChangeListener listener = e -> ++count[0];
    experiment.addChangeListener(listener);
    experiment.fireStateChange("one");
    experiment.removeChangeListener(listener);
    experiment.fireStateChange("two");
    assertEquals(1, count[0]);
  }

  @Test
  public void getReportString_defaultIsEmpty() {
    assertEquals("", new MockExperiment().getReportString());
  }

  @Test
  public void experimentEnum_createsMatchingExperiments() {
    assertTrue(ExperimentEnum.WOLLS.createExperiment() instanceof WollastonExperiment);
    assertTrue(ExperimentEnum.ONSKY.createExperiment() instanceof OnSkyExperiment);
    assertTrue(ExperimentEnum.CALFT.createExperiment() instanceof CalibrationFitExperiment);
    assertEquals("On-sky polarization", ExperimentEnum.ONSKY.getName());
  }

}
