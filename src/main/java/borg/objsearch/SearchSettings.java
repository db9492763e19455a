package borg.objsearch;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import borg.objsearch.channels.ColorMode;
import borg.objsearch.templatematching.CombineMode;

/**
 * Search parameters that can be kept in a JSON file
 */
public class SearchSettings {

	private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

	private double tolerance = 0.2;
	private int minSeparation = 10;
	private ColorMode colorMode = ColorMode.GRAYSCALE;
	private CombineMode combineMode = CombineMode.MAX;
	private int threads = Runtime.getRuntime().availableProcessors();

	public SearchSettings() {
		// Defaults
	}

	public SearchSettings(SearchSettings other) {
		this.tolerance = other.tolerance;
		this.minSeparation = other.minSeparation;
		this.colorMode = other.colorMode;
		this.combineMode = other.combineMode;
		this.threads = other.threads;
	}

	/**
	 * Defaults if the file does not exist
	 */
	public static SearchSettings load(File settingsFile) throws IOException {
		if (settingsFile.exists()) {
			try (InputStreamReader reader = new InputStreamReader(new BufferedInputStream(new FileInputStream(settingsFile)), StandardCharsets.UTF_8)) {
				return load(reader);
			}
		}
		return new SearchSettings();
	}

	public static SearchSettings load(Reader reader) throws IOException {
		try {
			SearchSettings settings = gson.fromJson(reader, SearchSettings.class);
			return settings == null ? new SearchSettings() : settings;
		} catch (JsonParseException e) {
			throw new IOException("Invalid search settings", e);
		}
	}

	public static void save(SearchSettings settings, File settingsFile) throws IOException {
		try (OutputStreamWriter writer = new OutputStreamWriter(new BufferedOutputStream(new FileOutputStream(settingsFile)), StandardCharsets.UTF_8)) {
			gson.toJson(settings, writer);
		}
	}

	/**
	 * @throws ObjectSearchException
	 *             If any value is out of range or a mode is unsupported
	 */
	public void validate() {
		if (!(this.tolerance > 0 && this.tolerance <= 1)) {
			throw new ObjectSearchException("Tolerance must be in (0,1] but is " + this.tolerance);
		}
		if (this.minSeparation < 0) {
			throw new ObjectSearchException("Minimum separation must not be negative but is " + this.minSeparation);
		}
		if (this.colorMode == null) {
			throw new ObjectSearchException("Unsupported color mode: null");
		}
		if (this.combineMode == null) {
			throw new ObjectSearchException("Unsupported combine mode: null");
		}
		if (this.threads <= 0) {
			throw new ObjectSearchException("Number of threads must be positive but is " + this.threads);
		}
	}

	public double getTolerance() {
		return tolerance;
	}

	public void setTolerance(double tolerance) {
		this.tolerance = tolerance;
	}

	public int getMinSeparation() {
		return minSeparation;
	}

	public void setMinSeparation(int minSeparation) {
		this.minSeparation = minSeparation;
	}

	public ColorMode getColorMode() {
		return colorMode;
	}

	public void setColorMode(ColorMode colorMode) {
		this.colorMode = colorMode;
	}

	public CombineMode getCombineMode() {
		return combineMode;
	}

	public void setCombineMode(CombineMode combineMode) {
		this.combineMode = combineMode;
	}

	public int getThreads() {
		return threads;
	}

	public void setThreads(int threads) {
		this.threads = threads;
	}

	@Override
	public String toString() {
		return "tolerance=" + this.tolerance + ", minSeparation=" + this.minSeparation + ", colorMode=" + this.colorMode + ", combineMode="
				+ this.combineMode + ", threads=" + this.threads;
	}

}
