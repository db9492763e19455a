package borg.objsearch;

import java.awt.Rectangle;
import java.io.PrintStream;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;
import borg.objsearch.channels.ColorMode;
import borg.objsearch.templatematching.CombineMode;
import borg.objsearch.templatematching.IndexMapper;

/**
 * Everything one search needs. Settings are copied when the context is created, later changes to the caller's
 * settings do not affect it.
 */
public class SearchContext {

	private final Planar<GrayF32> field;
	private final Planar<GrayF32> object;
	private final Rectangle searchRect;
	private final SearchSettings settings;
	private final PrintStream progress;

	public SearchContext(Planar<GrayF32> field, Planar<GrayF32> object, Rectangle searchRect, SearchSettings settings, PrintStream progress) {
		this.field = field;
		this.object = object;
		this.searchRect = new Rectangle(searchRect);
		this.settings = new SearchSettings(settings);
		this.progress = progress;
	}

	/**
	 * Checks everything that can be checked before the first distance is computed.
	 *
	 * @throws ObjectSearchException
	 *             On the first problem found
	 */
	public void validate() {
		this.settings.validate();
		if (this.field.getNumBands() < 3) {
			throw new ObjectSearchException("Field needs at least 3 bands but has " + this.field.getNumBands());
		}
		if (this.object.getNumBands() < 3) {
			throw new ObjectSearchException("Object needs at least 3 bands but has " + this.object.getNumBands());
		}
		if (this.object.width <= 0 || this.object.height <= 0) {
			throw new ObjectSearchException("Object must not be empty");
		}
		if (this.object.width > this.field.width || this.object.height > this.field.height) {
			throw new ObjectSearchException("Object (" + this.object.width + "x" + this.object.height + ") is larger than the field (" + this.field.width
					+ "x" + this.field.height + ")");
		}
		// Rejects empty rectangles and too many offsets for one buffer
		new IndexMapper(this.searchRect);
		Rectangle valid = ObjectSearch.fullSearchRect(this.field.width, this.field.height, this.object.width, this.object.height);
		if (!valid.contains(this.searchRect)) {
			throw new ObjectSearchException("Search rectangle " + this.searchRect + " places the object outside the field, valid offsets are " + valid);
		}
	}

	public Planar<GrayF32> getField() {
		return field;
	}

	public Planar<GrayF32> getObject() {
		return object;
	}

	public Rectangle getSearchRect() {
		return new Rectangle(searchRect);
	}

	public double getTolerance() {
		return this.settings.getTolerance();
	}

	public int getMinSeparation() {
		return this.settings.getMinSeparation();
	}

	public ColorMode getColorMode() {
		return this.settings.getColorMode();
	}

	public CombineMode getCombineMode() {
		return this.settings.getCombineMode();
	}

	public int getThreads() {
		return this.settings.getThreads();
	}

	/**
	 * May be <code>null</code>
	 */
	public PrintStream getProgress() {
		return progress;
	}

}
