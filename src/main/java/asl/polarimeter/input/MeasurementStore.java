package asl.polarimeter.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Holds the inputs an experiment is run on: a list of measurement pairs for polarization
 * recovery and a source Stokes vector for forward modeling. Either may be absent; each
 * experiment checks for what it needs before running.
 *
 * Unlike the values it holds, the store itself is mutable so that inputs can be loaded in
 * one at a time before a run.
 */
public class MeasurementStore {

  private final List<MeasurementPair> pairs;
  private StokesVector stokes;

  public MeasurementStore() {
    pairs = new ArrayList<>();
    stokes = null;
  }

  public MeasurementStore(List<MeasurementPair> pairs) {
    this();
    this.pairs.addAll(pairs);
  }

  public MeasurementStore(StokesVector stokes) {
    this();
    this.stokes = stokes;
  }

  public void addMeasurement(MeasurementPair pair) {
    pairs.add(pair);
  }

  /**
   * Add each row of a table in (I+, I-, HWP angle, parallactic angle) order
   * @param rows Measurement table, one measurement per row
   */
  public void addMeasurements(double[][] rows) {
    for (double[] row : rows) {
      pairs.add(MeasurementPair.fromArray(row));
    }
  }

  public List<MeasurementPair> getMeasurements() {
    return Collections.unmodifiableList(pairs);
  }

  public int measurementCount() {
    return pairs.size();
  }

  public void clearMeasurements() {
    pairs.clear();
  }

  public boolean stokesIsSet() {
    return stokes != null;
  }

  public StokesVector getStokes() {
    return stokes;
  }

  public void setStokes(StokesVector stokes) {
    this.stokes = stokes;
  }

}
