/*-
 * #%L
 * This file is part of Hybridizer.
 * %%
 * Copyright (C) 2026 Hybridizer developers
 * %%
 * Hybridizer is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Hybridizer is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Hybridizer.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package hybridizer;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import hybridizer.lib.awt.io.ImageFiles;
import hybridizer.lib.awt.text.TextImages;
import hybridizer.lib.common.ColorTools;
import hybridizer.lib.composite.HybridImagePipeline;
import hybridizer.lib.composite.HybridParameters;
import hybridizer.lib.composite.HybridResult;
import hybridizer.lib.composite.HybridSources;
import hybridizer.lib.io.GsonTools;

/**
 * Main Hybridizer launcher.
 * 
 * @author Hybridizer developers
 *
 */
@Command(name = "hybridizer", subcommands = {HelpCommand.class, FileCommand.class, TextCommand.class},
	description = "Create hybrid images, combining the low frequencies of one image with the high frequencies of others.",
	mixinStandardHelpOptions = true, version = "Hybridizer 0.1.0")
public class Hybridizer implements Runnable {
	
	private static final Logger logger = LoggerFactory.getLogger(Hybridizer.class);
	
	/**
	 * Supported log levels.
	 */
	public enum LogLevel {
		/** Log everything */
		ALL,
		/** Log trace and above */
		TRACE,
		/** Log debug and above */
		DEBUG,
		/** Log info and above */
		INFO,
		/** Log warnings and errors */
		WARN,
		/** Log errors only */
		ERROR,
		/** Log nothing */
		OFF
	}
	
	@Spec
	private CommandSpec spec;
	
	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"})
	private LogLevel logLevel = LogLevel.INFO;
	
	/**
	 * Main class to launch Hybridizer.
	 * 
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = createCommandLine().execute(args);
		System.exit(exitCode);
	}
	
	/**
	 * Create the command line used by {@link #main(String[])}.
	 * @return
	 */
	static CommandLine createCommandLine() {
		var cmd = new CommandLine(new Hybridizer());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		return cmd;
	}
	
	@Override
	public void run() {
		spec.commandLine().usage(System.out);
	}
	
	/**
	 * Set the root log level, if logging is backed by logback.
	 */
	void applyLogLevel() {
		var root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
		if (root instanceof ch.qos.logback.classic.Logger logbackLogger)
			logbackLogger.setLevel(Level.toLevel(logLevel.name()));
		else
			logger.debug("Cannot set log level for {}", root.getClass());
	}

}


/**
 * Options and behavior shared by all commands that create a hybrid image.
 */
abstract class HybridCommand implements Callable<Integer> {
	
	private static final Logger logger = LoggerFactory.getLogger(HybridCommand.class);
	
	@ParentCommand
	private Hybridizer parent;
	
	@Option(names = {"--a-blur"}, description = "Gaussian sigma used to low-pass filter the first image (default: " + HybridParameters.DEFAULT_LOW_PASS_SIGMA + ").", paramLabel = "sigma")
	private Double aBlur;
	
	@Option(names = {"--b-blur"}, description = "Sharpen amount used to high-pass filter the second image (default: " + HybridParameters.DEFAULT_SHARPEN_AMOUNT_B + ").", paramLabel = "amount")
	private Double bBlur;
	
	@Option(names = {"--c-blur"}, description = "Sharpen amount used to high-pass filter the third image (default: " + HybridParameters.DEFAULT_SHARPEN_AMOUNT_C + ").", paramLabel = "amount")
	private Double cBlur;
	
	@Option(names = {"--high-pass-sigma"}, description = "Gaussian sigma subtracted during high-pass filtering (default: same as --a-blur).", paramLabel = "sigma")
	private Double highPassSigma;
	
	@Option(names = {"--params"}, description = "JSON file containing parameters. Other options override values in the file.", paramLabel = "json")
	private File paramsFile;
	
	@Option(names = {"-o", "--output"}, description = "Output directory (default: current directory).", paramLabel = "dir")
	private File outputDir = new File(".");
	
	@Option(names = {"-f", "--format"}, description = "Output image format (default: ${DEFAULT-VALUE}).", paramLabel = "ext")
	private String format = "jpg";
	
	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;
	
	/**
	 * Create the source images.
	 * @return
	 * @throws IOException if the images cannot be read
	 */
	protected abstract HybridSources createSources() throws IOException;
	
	@Override
	public Integer call() {
		if (parent != null)
			parent.applyLogLevel();
		try {
			var params = buildParameters();
			var sources = createSources();
			var result = HybridImagePipeline.run(sources, params);
			writeResult(result);
			return 0;
		} catch (IOException | IllegalArgumentException e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}
	}
	
	HybridParameters buildParameters() throws IOException {
		HybridParameters params = null;
		if (paramsFile != null)
			params = GsonTools.readJson(paramsFile.toPath(), HybridParameters.class);
		if (params == null)
			params = HybridParameters.getDefault();
		var builder = params.validate().toBuilder();
		if (aBlur != null)
			builder.lowPassSigma(aBlur);
		if (bBlur != null)
			builder.sharpenAmountB(bBlur);
		if (cBlur != null)
			builder.sharpenAmountC(cBlur);
		if (highPassSigma != null)
			builder.highPassSigma(highPassSigma);
		return builder.build();
	}
	
	private void writeResult(HybridResult result) throws IOException {
		if (!outputDir.isDirectory() && !outputDir.mkdirs())
			throw new IOException("Unable to create output directory " + outputDir);
		for (var stage : result.getStages()) {
			var name = stage.getShortName();
			ImageFiles.write(result.getImage(stage), new File(outputDir, name + "." + format));
			ImageFiles.write(result.getSpectrum(stage), new File(outputDir, "fft_" + name + "." + format));
		}
		logger.info("Wrote {} stages to {}", result.getStages().size(), outputDir.getAbsolutePath());
	}
	
}


@Command(name = "file", description = "Create a hybrid image from image files of the same size.")
class FileCommand extends HybridCommand {
	
	@Parameters(index = "0", description = "Image providing low frequencies.", paramLabel = "imageA")
	private File fileA;
	
	@Parameters(index = "1", description = "Image providing high frequencies.", paramLabel = "imageB")
	private File fileB;
	
	@Parameters(index = "2", arity = "0..1", description = "Optional second image providing high frequencies.", paramLabel = "imageC")
	private File fileC;

	@Override
	protected HybridSources createSources() throws IOException {
		var imgA = ImageFiles.read(fileA);
		var imgB = ImageFiles.read(fileB);
		if (fileC == null)
			return HybridSources.of(imgA, imgB);
		return HybridSources.of(imgA, imgB, ImageFiles.read(fileC));
	}
	
}


@Command(name = "text", description = "Create a hybrid image from text messages.")
class TextCommand extends HybridCommand {
	
	private static final int HEIGHT = 200;
	private static final int X = 20;
	private static final int Y = 35;
	private static final float FONT_SIZE = 150f;
	
	@Parameters(index = "0", description = "Message providing low frequencies (drawn in red).", paramLabel = "msg1")
	private String msg1;
	
	@Parameters(index = "1", description = "Message providing high frequencies (drawn in green).", paramLabel = "msg2")
	private String msg2;
	
	@Parameters(index = "2", arity = "0..1", description = "Optional second message providing high frequencies (drawn in blue).", paramLabel = "msg3")
	private String msg3;

	@Override
	protected HybridSources createSources() {
		int width = TextImages.canvasWidth(msg1, msg2, msg3);
		var imgA = TextImages.render(msg1, width, HEIGHT, X, Y, FONT_SIZE, ColorTools.RED);
		var imgB = TextImages.render(msg2, width, HEIGHT, X, Y, FONT_SIZE, ColorTools.GREEN);
		if (msg3 == null)
			return HybridSources.of(imgA, imgB);
		return HybridSources.of(imgA, imgB, TextImages.render(msg3, width, HEIGHT, X, Y, FONT_SIZE, ColorTools.BLUE));
	}
	
}
