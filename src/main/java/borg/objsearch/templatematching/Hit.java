package borg.objsearch.templatematching;

import java.awt.Point;
import java.io.Serializable;
import java.util.Locale;

/**
 * A detected occurrence of the object in the field. The location is the top-left corner of the object, a lower score
 * is a better match.
 */
public final class Hit implements Serializable {

	private static final long serialVersionUID = -2284310559146473085L;

	private final int x;
	private final int y;
	private final double score;

	public Hit(int x, int y, double score) {
		this.x = x;
		this.y = y;
		this.score = score;
	}

	public Hit(Point location, double score) {
		this(location.x, location.y, score);
	}

	/**
	 * Chebyshev distance, i.e. the larger of the x- and y-distances between both locations
	 */
	public int distance(Hit other) {
		return Math.max(Math.abs(this.x - other.x), Math.abs(this.y - other.y));
	}

	public Point getLocation() {
		return new Point(this.x, this.y);
	}

	public int getX() {
		return this.x;
	}

	public int getY() {
		return this.y;
	}

	/**
	 * Normalized distance in [0,1], 0 is an exact match
	 */
	public double getScore() {
		return this.score;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Hit other = (Hit) obj;
		if (x != other.x)
			return false;
		if (y != other.y)
			return false;
		if (Double.doubleToLongBits(score) != Double.doubleToLongBits(other.score))
			return false;
		return true;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + x;
		result = prime * result + y;
		long temp = Double.doubleToLongBits(score);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		return result;
	}

	@Override
	public String toString() {
		return this.x + "/" + this.y + " " + String.format(Locale.ROOT, "%.4f", this.score);
	}

}
