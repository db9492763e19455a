package borg.objsearch.templatematching;

import java.awt.Point;
import java.awt.Rectangle;

import borg.objsearch.ObjectSearchException;

/**
 * Maps coordinates inside a search rectangle to indices of a flat, row-major buffer and back.
 */
public class IndexMapper {

	private final int minX;
	private final int minY;
	private final int width;
	private final int height;
	private final int size;

	public IndexMapper(Rectangle searchRect) {
		if (searchRect.width <= 0 || searchRect.height <= 0) {
			throw new ObjectSearchException("Search rectangle must not be empty: " + searchRect);
		}
		this.minX = searchRect.x;
		this.minY = searchRect.y;
		this.width = searchRect.width;
		this.height = searchRect.height;
		try {
			this.size = Math.multiplyExact(this.width, this.height);
		} catch (ArithmeticException e) {
			throw new ObjectSearchException("Search rectangle has too many offsets: " + searchRect, e);
		}
	}

	/**
	 * Buffer index of (x,y). The top-left corner maps to 0, x varies fastest.
	 */
	public int offset(int x, int y) {
		if (x < this.minX || x >= this.minX + this.width || y < this.minY || y >= this.minY + this.height) {
			throw new IndexOutOfBoundsException("(" + x + "," + y + ") is outside of " + this.toString());
		}
		return (x - this.minX) + this.width * (y - this.minY);
	}

	public int x(int i) {
		this.checkIndex(i);
		return this.minX + (i % this.width);
	}

	public int y(int i) {
		this.checkIndex(i);
		return this.minY + (i / this.width);
	}

	/**
	 * Inverse of {@link #offset(int, int)}
	 */
	public Point coords(int i) {
		return new Point(this.x(i), this.y(i));
	}

	/**
	 * Number of buffer entries, one per offset in the rectangle
	 */
	public int size() {
		return this.size;
	}

	public int getMinX() {
		return this.minX;
	}

	public int getMinY() {
		return this.minY;
	}

	public int getWidth() {
		return this.width;
	}

	public int getHeight() {
		return this.height;
	}

	private void checkIndex(int i) {
		if (i < 0 || i >= this.size()) {
			throw new IndexOutOfBoundsException("Index " + i + " is outside of " + this.toString());
		}
	}

	@Override
	public String toString() {
		return this.minX + "/" + this.minY + " (" + this.width + "x" + this.height + ")";
	}

}
