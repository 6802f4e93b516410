/**
 **
 ** ReconstructionParameters - Class for handling multiple configuration parameters
 ** of the penumbral image reconstruction
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ReconstructionParameters.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.penumbral.common;

import java.util.Properties;

import ij.gui.GenericDialog;

/**
 * All the tunable constants of the reconstruction. The pipeline classes keep their own clone,
 * so a parameter instance can be edited (dialog, properties) while nothing is running with it.
 */
public class ReconstructionParameters {
	// geometry and resolution
	public double  object_size =                     200e-4; // cm, expected source extent
	public double  default_view_radius =               5.0; // cm, used before the data defines it (aperture pitch default)
	public double  spread =                           1.05; // kernel/image extent in aperture radii, covers charging tails
	public int     resolution =                         50; // bins per object size in the image plane
	public int     max_bins =                         1000; // limit of the image/detector grid size
	public int     lattice_half_extent =                 6; // aperture lattice rows/columns on each side to consider
	// track selection
	public double  max_contrast =                     35.0; // %, tracks with higher contrast are noise
	public double  max_eccentricity =                 15.0; // %, tracks with higher eccentricity are overlaps
	public double  filter_loss =                       2.0; // MeV lost in the filter before the detector
	public double  max_energy =                       12.0; // MeV, upper limit of the energy at the aperture
	// objective
	public double  non_statistical_noise =             0.0; // relative noise added to the counting one
	public double  expected_magnification_accuracy =  4e-3; // scale of the affine distortion prior
	public double  charge_prior_scale =               0.05; // charge values of this size cost one unit of log-likelihood
	public double  range_floor =                       1.0; // counts, background floor in the contrast penalty
	public boolean fit_affine =                      false; // fit affine magnification distortion in the first stage
	// simplex optimizer
	public double  initial_charge =                    0.1; // simplex seed value of the aperture charge
	public double  initial_charge_step =              0.09; // simplex seed step of the aperture charge
	public double  simplex_relative_tolerance =       1e-7;
	public double  simplex_absolute_tolerance =       1e-4;
	public int     simplex_max_evaluations =          4000;
	// deconvolution
	public double  threshold =                        1e-4; // log-likelihood gain per count to stop deconvolution
	public int     deconvolution_max_iterations =     2000;
	public double  reach_low_quantile =               0.05; // data pixels should be reached by more than this kernel fraction
	public double  reach_high_quantile =              0.70; // and less than this one
	public int     kernel_supersample =                  3; // sub-pixel samples per kernel pixel in each direction
	public double  chi2_threshold =                    2.0; // maximal chi2 per data pixel to accept the result
	// input/output
	public String  scan_directory =                "scans";
	public String  results_directory =           "results";
	public boolean save_results =                    false;
	public int     track_header_line =                  20; // line with the column names in track files
	public int     track_skip_line =                    24; // metadata line to skip in track files
	public int     debug_level =                         0;

	public ReconstructionParameters() {
	}

	public boolean showDialog(String title) {
		GenericDialog gd = new GenericDialog(title);
		gd.addMessage("--- Geometry and resolution ---");
		gd.addNumericField("Expected source size",                            this.object_size*1e4,       1,8,"um");
		gd.addNumericField("Default view radius",                             this.default_view_radius,   3,8,"cm");
		gd.addNumericField("Kernel spread (in aperture radii)",               this.spread,                3);
		gd.addNumericField("Resolution (bins per source size)",               this.resolution,            0);
		gd.addNumericField("Maximal number of bins",                          this.max_bins,              0);
		gd.addNumericField("Aperture lattice half extent",                    this.lattice_half_extent,   0);
		gd.addMessage("--- Track selection ---");
		gd.addNumericField("Maximal track contrast",                          this.max_contrast,          1,6,"%");
		gd.addNumericField("Maximal track eccentricity",                      this.max_eccentricity,      1,6,"%");
		gd.addNumericField("Energy lost in the filter",                       this.filter_loss,           2,6,"MeV");
		gd.addNumericField("Maximal energy at the aperture",                  this.max_energy,            2,6,"MeV");
		gd.addMessage("--- Geometry fit ---");
		gd.addNumericField("Non-statistical noise",                           this.non_statistical_noise, 4);
		gd.addNumericField("Expected magnification accuracy",                 this.expected_magnification_accuracy, 5);
		gd.addNumericField("Charge prior scale",                              this.charge_prior_scale,    4);
		gd.addNumericField("Background floor for the contrast penalty",       this.range_floor,           3,6,"counts");
		gd.addCheckbox    ("Fit affine magnification distortion",             this.fit_affine);
		gd.addNumericField("Initial aperture charge",                         this.initial_charge,        4);
		gd.addNumericField("Initial aperture charge step",                    this.initial_charge_step,   4);
		gd.addNumericField("Simplex relative tolerance",                      this.simplex_relative_tolerance, 9);
		gd.addNumericField("Simplex absolute tolerance",                      this.simplex_absolute_tolerance, 9);
		gd.addNumericField("Simplex maximal evaluations",                     this.simplex_max_evaluations, 0);
		gd.addMessage("--- Deconvolution ---");
		gd.addNumericField("Log-likelihood threshold",                        this.threshold,             7);
		gd.addNumericField("Maximal deconvolution iterations",                this.deconvolution_max_iterations, 0);
		gd.addNumericField("Low quantile of the kernel reach",                this.reach_low_quantile,    3);
		gd.addNumericField("High quantile of the kernel reach",               this.reach_high_quantile,   3);
		gd.addNumericField("Kernel supersampling",                            this.kernel_supersample,    0);
		gd.addNumericField("Maximal chi2 per pixel",                          this.chi2_threshold,        3);
		gd.addMessage("--- Input/output ---");
		gd.addStringField ("Scan directory",                                  this.scan_directory,        40);
		gd.addStringField ("Results directory",                               this.results_directory,     40);
		gd.addCheckbox    ("Save brightness maps as TIFF",                    this.save_results);
		gd.addNumericField("Track file header line",                          this.track_header_line,     0);
		gd.addNumericField("Track file line to skip",                         this.track_skip_line,       0);
		gd.addNumericField("Debug level",                                     this.debug_level,           0);
		gd.showDialog();
		if (gd.wasCanceled()) return false;
		this.object_size =                     gd.getNextNumber()*1e-4;
		this.default_view_radius =             gd.getNextNumber();
		this.spread =                          gd.getNextNumber();
		this.resolution =                (int) gd.getNextNumber();
		this.max_bins =                  (int) gd.getNextNumber();
		this.lattice_half_extent =       (int) gd.getNextNumber();
		this.max_contrast =                    gd.getNextNumber();
		this.max_eccentricity =                gd.getNextNumber();
		this.filter_loss =                     gd.getNextNumber();
		this.max_energy =                      gd.getNextNumber();
		this.non_statistical_noise =           gd.getNextNumber();
		this.expected_magnification_accuracy = gd.getNextNumber();
		this.charge_prior_scale =              gd.getNextNumber();
		this.range_floor =                     gd.getNextNumber();
		this.fit_affine =                      gd.getNextBoolean();
		this.initial_charge =                  gd.getNextNumber();
		this.initial_charge_step =             gd.getNextNumber();
		this.simplex_relative_tolerance =      gd.getNextNumber();
		this.simplex_absolute_tolerance =      gd.getNextNumber();
		this.simplex_max_evaluations =   (int) gd.getNextNumber();
		this.threshold =                       gd.getNextNumber();
		this.deconvolution_max_iterations = (int) gd.getNextNumber();
		this.reach_low_quantile =              gd.getNextNumber();
		this.reach_high_quantile =             gd.getNextNumber();
		this.kernel_supersample =        (int) gd.getNextNumber();
		this.chi2_threshold =                  gd.getNextNumber();
		this.scan_directory =                  gd.getNextString();
		this.results_directory =               gd.getNextString();
		this.save_results =                    gd.getNextBoolean();
		this.track_header_line =         (int) gd.getNextNumber();
		this.track_skip_line =           (int) gd.getNextNumber();
		this.debug_level =               (int) gd.getNextNumber();
		return true;
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"object_size",                     this.object_size+"");                     // double
		properties.setProperty(prefix+"default_view_radius",             this.default_view_radius+"");             // double
		properties.setProperty(prefix+"spread",                          this.spread+"");                          // double
		properties.setProperty(prefix+"resolution",                      this.resolution+"");                      // int
		properties.setProperty(prefix+"max_bins",                        this.max_bins+"");                        // int
		properties.setProperty(prefix+"lattice_half_extent",             this.lattice_half_extent+"");             // int
		properties.setProperty(prefix+"max_contrast",                    this.max_contrast+"");                    // double
		properties.setProperty(prefix+"max_eccentricity",                this.max_eccentricity+"");                // double
		properties.setProperty(prefix+"filter_loss",                     this.filter_loss+"");                     // double
		properties.setProperty(prefix+"max_energy",                      this.max_energy+"");                      // double
		properties.setProperty(prefix+"non_statistical_noise",           this.non_statistical_noise+"");           // double
		properties.setProperty(prefix+"expected_magnification_accuracy", this.expected_magnification_accuracy+""); // double
		properties.setProperty(prefix+"charge_prior_scale",              this.charge_prior_scale+"");              // double
		properties.setProperty(prefix+"range_floor",                     this.range_floor+"");                     // double
		properties.setProperty(prefix+"fit_affine",                      this.fit_affine+"");                      // boolean
		properties.setProperty(prefix+"initial_charge",                  this.initial_charge+"");                  // double
		properties.setProperty(prefix+"initial_charge_step",             this.initial_charge_step+"");             // double
		properties.setProperty(prefix+"simplex_relative_tolerance",      this.simplex_relative_tolerance+"");      // double
		properties.setProperty(prefix+"simplex_absolute_tolerance",      this.simplex_absolute_tolerance+"");      // double
		properties.setProperty(prefix+"simplex_max_evaluations",         this.simplex_max_evaluations+"");         // int
		properties.setProperty(prefix+"threshold",                       this.threshold+"");                       // double
		properties.setProperty(prefix+"deconvolution_max_iterations",    this.deconvolution_max_iterations+"");    // int
		properties.setProperty(prefix+"reach_low_quantile",              this.reach_low_quantile+"");              // double
		properties.setProperty(prefix+"reach_high_quantile",             this.reach_high_quantile+"");             // double
		properties.setProperty(prefix+"kernel_supersample",              this.kernel_supersample+"");              // int
		properties.setProperty(prefix+"chi2_threshold",                  this.chi2_threshold+"");                  // double
		properties.setProperty(prefix+"scan_directory",                  this.scan_directory);                     // String
		properties.setProperty(prefix+"results_directory",               this.results_directory);                  // String
		properties.setProperty(prefix+"save_results",                    this.save_results+"");                    // boolean
		properties.setProperty(prefix+"track_header_line",               this.track_header_line+"");               // int
		properties.setProperty(prefix+"track_skip_line",                 this.track_skip_line+"");                 // int
		properties.setProperty(prefix+"debug_level",                     this.debug_level+"");                     // int
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"object_size")!=null)                     this.object_size=Double.parseDouble(properties.getProperty(prefix+"object_size"));
		if (properties.getProperty(prefix+"default_view_radius")!=null)             this.default_view_radius=Double.parseDouble(properties.getProperty(prefix+"default_view_radius"));
		if (properties.getProperty(prefix+"spread")!=null)                          this.spread=Double.parseDouble(properties.getProperty(prefix+"spread"));
		if (properties.getProperty(prefix+"resolution")!=null)                      this.resolution=Integer.parseInt(properties.getProperty(prefix+"resolution"));
		if (properties.getProperty(prefix+"max_bins")!=null)                        this.max_bins=Integer.parseInt(properties.getProperty(prefix+"max_bins"));
		if (properties.getProperty(prefix+"lattice_half_extent")!=null)             this.lattice_half_extent=Integer.parseInt(properties.getProperty(prefix+"lattice_half_extent"));
		if (properties.getProperty(prefix+"max_contrast")!=null)                    this.max_contrast=Double.parseDouble(properties.getProperty(prefix+"max_contrast"));
		if (properties.getProperty(prefix+"max_eccentricity")!=null)                this.max_eccentricity=Double.parseDouble(properties.getProperty(prefix+"max_eccentricity"));
		if (properties.getProperty(prefix+"filter_loss")!=null)                     this.filter_loss=Double.parseDouble(properties.getProperty(prefix+"filter_loss"));
		if (properties.getProperty(prefix+"max_energy")!=null)                      this.max_energy=Double.parseDouble(properties.getProperty(prefix+"max_energy"));
		if (properties.getProperty(prefix+"non_statistical_noise")!=null)           this.non_statistical_noise=Double.parseDouble(properties.getProperty(prefix+"non_statistical_noise"));
		if (properties.getProperty(prefix+"expected_magnification_accuracy")!=null) this.expected_magnification_accuracy=Double.parseDouble(properties.getProperty(prefix+"expected_magnification_accuracy"));
		if (properties.getProperty(prefix+"charge_prior_scale")!=null)              this.charge_prior_scale=Double.parseDouble(properties.getProperty(prefix+"charge_prior_scale"));
		if (properties.getProperty(prefix+"range_floor")!=null)                     this.range_floor=Double.parseDouble(properties.getProperty(prefix+"range_floor"));
		if (properties.getProperty(prefix+"fit_affine")!=null)                      this.fit_affine=Boolean.parseBoolean(properties.getProperty(prefix+"fit_affine"));
		if (properties.getProperty(prefix+"initial_charge")!=null)                  this.initial_charge=Double.parseDouble(properties.getProperty(prefix+"initial_charge"));
		if (properties.getProperty(prefix+"initial_charge_step")!=null)             this.initial_charge_step=Double.parseDouble(properties.getProperty(prefix+"initial_charge_step"));
		if (properties.getProperty(prefix+"simplex_relative_tolerance")!=null)      this.simplex_relative_tolerance=Double.parseDouble(properties.getProperty(prefix+"simplex_relative_tolerance"));
		if (properties.getProperty(prefix+"simplex_absolute_tolerance")!=null)      this.simplex_absolute_tolerance=Double.parseDouble(properties.getProperty(prefix+"simplex_absolute_tolerance"));
		if (properties.getProperty(prefix+"simplex_max_evaluations")!=null)         this.simplex_max_evaluations=Integer.parseInt(properties.getProperty(prefix+"simplex_max_evaluations"));
		if (properties.getProperty(prefix+"threshold")!=null)                       this.threshold=Double.parseDouble(properties.getProperty(prefix+"threshold"));
		if (properties.getProperty(prefix+"deconvolution_max_iterations")!=null)    this.deconvolution_max_iterations=Integer.parseInt(properties.getProperty(prefix+"deconvolution_max_iterations"));
		if (properties.getProperty(prefix+"reach_low_quantile")!=null)              this.reach_low_quantile=Double.parseDouble(properties.getProperty(prefix+"reach_low_quantile"));
		if (properties.getProperty(prefix+"reach_high_quantile")!=null)             this.reach_high_quantile=Double.parseDouble(properties.getProperty(prefix+"reach_high_quantile"));
		if (properties.getProperty(prefix+"kernel_supersample")!=null)              this.kernel_supersample=Integer.parseInt(properties.getProperty(prefix+"kernel_supersample"));
		if (properties.getProperty(prefix+"chi2_threshold")!=null)                  this.chi2_threshold=Double.parseDouble(properties.getProperty(prefix+"chi2_threshold"));
		if (properties.getProperty(prefix+"scan_directory")!=null)                  this.scan_directory=properties.getProperty(prefix+"scan_directory");
		if (properties.getProperty(prefix+"results_directory")!=null)               this.results_directory=properties.getProperty(prefix+"results_directory");
		if (properties.getProperty(prefix+"save_results")!=null)                    this.save_results=Boolean.parseBoolean(properties.getProperty(prefix+"save_results"));
		if (properties.getProperty(prefix+"track_header_line")!=null)               this.track_header_line=Integer.parseInt(properties.getProperty(prefix+"track_header_line"));
		if (properties.getProperty(prefix+"track_skip_line")!=null)                 this.track_skip_line=Integer.parseInt(properties.getProperty(prefix+"track_skip_line"));
		if (properties.getProperty(prefix+"debug_level")!=null)                     this.debug_level=Integer.parseInt(properties.getProperty(prefix+"debug_level"));
	}

	@Override
	public ReconstructionParameters clone() {
		ReconstructionParameters rp =        new ReconstructionParameters();
		rp.object_size =                     this.object_size;
		rp.default_view_radius =             this.default_view_radius;
		rp.spread =                          this.spread;
		rp.resolution =                      this.resolution;
		rp.max_bins =                        this.max_bins;
		rp.lattice_half_extent =             this.lattice_half_extent;
		rp.max_contrast =                    this.max_contrast;
		rp.max_eccentricity =                this.max_eccentricity;
		rp.filter_loss =                     this.filter_loss;
		rp.max_energy =                      this.max_energy;
		rp.non_statistical_noise =           this.non_statistical_noise;
		rp.expected_magnification_accuracy = this.expected_magnification_accuracy;
		rp.charge_prior_scale =              this.charge_prior_scale;
		rp.range_floor =                     this.range_floor;
		rp.fit_affine =                      this.fit_affine;
		rp.initial_charge =                  this.initial_charge;
		rp.initial_charge_step =             this.initial_charge_step;
		rp.simplex_relative_tolerance =      this.simplex_relative_tolerance;
		rp.simplex_absolute_tolerance =      this.simplex_absolute_tolerance;
		rp.simplex_max_evaluations =         this.simplex_max_evaluations;
		rp.threshold =                       this.threshold;
		rp.deconvolution_max_iterations =    this.deconvolution_max_iterations;
		rp.reach_low_quantile =              this.reach_low_quantile;
		rp.reach_high_quantile =             this.reach_high_quantile;
		rp.kernel_supersample =              this.kernel_supersample;
		rp.chi2_threshold =                  this.chi2_threshold;
		rp.scan_directory =                  this.scan_directory;
		rp.results_directory =               this.results_directory;
		rp.save_results =                    this.save_results;
		rp.track_header_line =               this.track_header_line;
		rp.track_skip_line =                 this.track_skip_line;
		rp.debug_level =                     this.debug_level;
		return rp;
	}
}
