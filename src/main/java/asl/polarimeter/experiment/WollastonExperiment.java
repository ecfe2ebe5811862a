package asl.polarimeter.experiment;

import asl.polarimeter.input.Configuration;
import asl.polarimeter.input.MeasurementStore;
import asl.polarimeter.input.StokesVector;
import asl.polarimeter.optics.BeamIntensities;
import asl.polarimeter.optics.SystemConfiguration;
import asl.polarimeter.optics.WollastonBeam;
import asl.polarimeter.utils.NumericUtils;
import java.text.DecimalFormat;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Forward model of the two prism channels: passes the store's Stokes vector through a half-wave
 * plate and the Wollaston prism, giving the beam intensities at the chosen plate angle and the
 * modulation of both beams as the plate turns through a full circle.
 */
public class WollastonExperiment extends Experiment {

  private double hwpAngle;
  private double modulationStep;
  private BeamIntensities beams;
  private double totalIntensity;

  public WollastonExperiment() {
    super();
    hwpAngle = 0.;
    modulationStep = Configuration.getInstance().getModulationStep();
  }

  /**
   * Build the train this experiment evaluates: the half-wave plate alone ahead of the prism
   * @param angle HWP angle in degrees
   * @return configuration with a single half-wave plate
   */
  static SystemConfiguration plateAndPrism(double angle) {
    return SystemConfiguration.builder().halfWavePlate(angle).build();
  }

  @Override
  protected void backend(MeasurementStore store) {
    StokesVector stokes = store.getStokes();
    dataNames.add(stokes.toString());

    SystemConfiguration system = plateAndPrism(hwpAngle);
    beams = system.beamIntensities(stokes);
    totalIntensity = system.totalIntensity(stokes);

    XYSeries ordinary = new XYSeries(WollastonBeam.ORDINARY.getLabel() + " beam (I+)");
    XYSeries extraordinary =
        new XYSeries(WollastonBeam.EXTRAORDINARY.getLabel() + " beam (I-)");
    XYSeries difference = new XYSeries("I+ - I-");

    fireStateChange("Computing modulation curve...");
    int points = (int) Math.ceil(NumericUtils.FULL_CIRCLE_DEGREES / modulationStep);
    for (int i = 0; i < points; ++i) {
      double angle = i * modulationStep;
      BeamIntensities atAngle = plateAndPrism(angle).beamIntensities(stokes);
      ordinary.add(angle, atAngle.getPlus());
      extraordinary.add(angle, atAngle.getMinus());
      difference.add(angle, atAngle.difference());
    }

    XYSeriesCollection beamCurves = new XYSeriesCollection();
    beamCurves.addSeries(ordinary);
    beamCurves.addSeries(extraordinary);
    xySeriesData.add(beamCurves);
    xySeriesData.add(new XYSeriesCollection(difference));
  }

  public BeamIntensities getBeams() {
    return beams;
  }

  /**
   * @return intensity reaching the prism before it splits the light
   */
  public double getTotalIntensity() {
    return totalIntensity;
  }

  public double getHwpAngle() {
    return hwpAngle;
  }

  /**
   * Set the HWP angle the beam intensities are reported at
   * @param hwpAngle angle in degrees
   */
  public void setHwpAngle(double hwpAngle) {
    this.hwpAngle = hwpAngle;
  }

  /**
   * Set the spacing of HWP angles in the modulation curve
   * @param modulationStep step in degrees, must be positive
   */
  public void setModulationStep(double modulationStep) {
    if (!(modulationStep > 0)) {
      throw new IllegalArgumentException("Modulation step must be positive: " + modulationStep);
    }
    this.modulationStep = modulationStep;
  }

  @Override
  String[] getDataStrings() {
    DecimalFormat df = DECIMAL_FORMAT.get();
    return new String[]{
        "Input: " + dataNames.get(0),
        "HWP angle: " + df.format(hwpAngle),
        "I+ (o beam): " + df.format(beams.getPlus())
            + "\nI- (e beam): " + df.format(beams.getMinus())
            + "\nTotal: " + df.format(totalIntensity)
    };
  }

  @Override
  public int measurementsNeeded() {
    return 0;
  }

  @Override
  public boolean hasEnoughData(MeasurementStore store) {
    return store.stokesIsSet();
  }

}
