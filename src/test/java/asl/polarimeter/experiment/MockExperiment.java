package asl.polarimeter.experiment;

import asl.polarimeter.input.MeasurementStore;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;

class MockExperiment extends Experiment {

  boolean backendCalled = false;
  boolean hasEnoughDataCalled = false;

  boolean setHasEnoughData = true;
  /**
   * Counts the total number of times fireStateChange was called.
   */
  int numberOfChangesFired = 0;

  MockExperiment() {
    super();
    this.addChangeListener(new ChangeCountingListener());
  }

  @Override
  protected void backend(final MeasurementStore store) {
    backendCalled = true;
  }

  @Override
  public int measurementsNeeded() {
    return 0;
  }

  @Override
  public boolean hasEnoughData(MeasurementStore store) {
    hasEnoughDataCalled = true;
    return setHasEnoughData;
  }

  private class ChangeCountingListener implements ChangeListener {

    public void stateChanged(ChangeEvent event) {
      numberOfChangesFired++;
    }
  }

}
