package borg.objsearch.templatematching;

import java.util.Arrays;

/**
 * Object-field distances, one per offset of the search rectangle, together with the smallest and largest distance
 * observed.
 */
public class DistanceResult {

	private final double[] distances;
	private final double min;
	private final double max;

	private DistanceResult(double[] distances, double min, double max) {
		this.distances = distances;
		this.min = min;
		this.max = max;
	}

	/**
	 * Takes ownership of the array, callers must not modify it afterwards.
	 */
	static DistanceResult of(double[] distances) {
		if (distances.length == 0) {
			throw new IllegalArgumentException("No distances");
		}
		double min = distances[0];
		double max = distances[0];
		for (int i = 1; i < distances.length; i++) {
			if (distances[i] < min) {
				min = distances[i];
			}
			if (distances[i] > max) {
				max = distances[i];
			}
		}
		return new DistanceResult(distances, min, max);
	}

	public double getDistance(int i) {
		return this.distances[i];
	}

	public int size() {
		return this.distances.length;
	}

	public double getMin() {
		return this.min;
	}

	public double getMax() {
		return this.max;
	}

	public double[] toArray() {
		return Arrays.copyOf(this.distances, this.distances.length);
	}

	double[] distances() {
		return this.distances;
	}

	@Override
	public String toString() {
		return this.distances.length + " distances in [" + this.min + ", " + this.max + "]";
	}

}
