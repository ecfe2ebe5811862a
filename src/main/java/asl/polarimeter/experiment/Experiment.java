package asl.polarimeter.experiment;

import asl.polarimeter.input.MeasurementStore;
import asl.polarimeter.utils.NumericUtils;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * This class defines template patterns for each type of polarimeter experiment
 * (we use this term in the code to prevent confusion with the overloaded term
 * "test"). Concrete extensions of this class define a backend for the calculations,
 * the results of which are read back through getters specific to each experiment
 * along with plot-ready series data.
 *
 * Experiments work in a manner similar to builder patterns: experiments that
 * rely on variables to determine how their calculations are run, such as
 * the on-sky experiment's instrument model or the calibration fit's configuration,
 * have those values set first, and then "runExperimentOnData" is called with a
 * MeasurementStore containing the relevant inputs.
 *
 * Getters for results should not be called unless the experiment has already been run,
 * as they will otherwise not be populated with valid results.
 *
 * @author akearns - KBRWyle
 */
public abstract class Experiment {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.######");
        NumericUtils.setInfinityPrintable(format);
        return format;
      });

  private final EventListenerList eventHelper;
  List<XYSeriesCollection> xySeriesData;
  /**
   * Names of the inputs used in the calculation (e.g., standard star names),
   * mainly used in report generation
   */
  List<String> dataNames;
  private String status;

  /**
   * Initialize all fields common to experiment objects
   */
  Experiment() {
    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();
    status = "";
    eventHelper = new EventListenerList();
  }

  /**
   * Stub method to be overridden for other methods to produce String data for experiment result.
   * Includes formatting of numeric data.
   * @return String containing human-readable data
   */
  String[] getDataStrings() {
    return new String[]{""};
  }

  /**
   * Produce a report of the experiment's results, one data string per paragraph
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      sb.append(strings[i]);
      if (i + 1 < strings.length) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * Add an object to the list of objects to be notified when the experiment's
   * status changes
   *
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  public void removeChangeListener(ChangeListener listener) {
    eventHelper.remove(ChangeListener.class, listener);
  }

  /**
   * Abstract function that runs the calculations specific to a given procedure,
   * overwritten by concrete experiments with specific operations.
   *
   * @param store Object containing the inputs to process
   */
  protected abstract void backend(final MeasurementStore store);

  /**
   * Return the number of measurement pairs needed by the experiment, or 0 if the experiment
   * does not run on measurements
   *
   * @return Number of measurement pairs needed
   */
  public abstract int measurementsNeeded();

  /**
   * Update processing status and notify listeners of change
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Return the plottable data for this experiment, populated in the backend
   * function of an implementing class. The results are returned as a list, where each list
   * is the data to be placed into a separate chart.
   *
   * @return Plottable data
   */
  public List<XYSeriesCollection> getData() {
    return xySeriesData;
  }

  /**
   * Get the names of data sent into the experiment (set during backend calculations)
   *
   * @return Names of the inputs
   */
  public List<String> getInputNames() {
    return dataNames;
  }

  /**
   * Return newest status message produced by this experiment
   *
   * @return String representing status of the calculation
   */
  public String getStatus() {
    return status;
  }

  /**
   * Used to check if the current input has enough data to do the calculation.
   *
   * @param store MeasurementStore to be fed into experiment calculation
   * @return True if there is enough data to be run
   */
  public abstract boolean hasEnoughData(final MeasurementStore store);

  /**
   * Driver to do data processing on inputted data (calls a concrete backend
   * method which is different for each type of experiment)
   *
   * @param store Inputs to be processed
   * @throws IllegalArgumentException if the store lacks the inputs this experiment needs
   */
  public void runExperimentOnData(final MeasurementStore store) {

    fireStateChange("Beginning loading data...");

    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();

    if (!hasEnoughData(store)) {
      throw new IllegalArgumentException("Not enough data loaded to run "
          + getClass().getSimpleName());
    }

    fireStateChange("Beginning calculations...");

    backend(store);

    fireStateChange("Calculations done!");
  }
}
