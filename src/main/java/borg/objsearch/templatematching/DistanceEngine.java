package borg.objsearch.templatematching;

import java.awt.Rectangle;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.struct.image.GrayF32;
import borg.objsearch.ObjectSearchException;

/**
 * Computes the L1 distance between the object and the field at every offset of a search rectangle.
 * <p>
 * Work is split by column: every row of a column becomes its own task on the thread pool, and the column is finished
 * before progress is written and the next column starts. Each task writes exactly one slot of the distance buffer.
 */
public class DistanceEngine {

	static final Logger logger = LoggerFactory.getLogger(DistanceEngine.class);

	private final ExecutorService threadPool;
	private final PrintStream progress;

	/**
	 * @param progress
	 *            Receives textual progress, may be <code>null</code>
	 */
	public DistanceEngine(ExecutorService threadPool, PrintStream progress) {
		this.threadPool = threadPool;
		this.progress = progress;
	}

	/**
	 * @param field
	 *            Single channel, normalized to [0,1]
	 * @param object
	 *            Single channel, normalized to [0,1]
	 * @param searchRect
	 *            Top-left corners to test, the object must stay inside the field at every one of them
	 */
	public DistanceResult computeDistances(GrayF32 field, GrayF32 object, Rectangle searchRect) throws InterruptedException {
		this.progress("\n");
		DistanceResult result = this.computeDistances(field, object, searchRect, 0, 1);
		this.progress("\n");
		return result;
	}

	/**
	 * Computes one channel of a multi-channel search. Progress covers all channels, so it keeps rising from channel to
	 * channel. The caller writes the leading and trailing newline.
	 *
	 * @param channel
	 *            Index of this channel, starting at 0
	 * @param channels
	 *            Total number of channels of the search
	 */
	public DistanceResult computeDistances(final GrayF32 field, final GrayF32 object, Rectangle searchRect, int channel, int channels)
			throws InterruptedException {
		if (channel < 0 || channel >= channels) {
			throw new IllegalArgumentException("Channel " + channel + " of " + channels);
		}
		checkFootprint(field, object, searchRect);

		final long start = System.currentTimeMillis();
		final IndexMapper mapper = new IndexMapper(searchRect);
		final double[] distances = new double[mapper.size()];

		final List<Future<?>> column = new ArrayList<>(mapper.getHeight());
		for (int u = mapper.getMinX(); u < mapper.getMinX() + mapper.getWidth(); u++) {
			column.clear();
			for (int v = mapper.getMinY(); v < mapper.getMinY() + mapper.getHeight(); v++) {
				final int xInField = u;
				final int yInField = v;
				column.add(this.threadPool.submit(new Runnable() {
					@Override
					public void run() {
						distances[mapper.offset(xInField, yInField)] = l1Distance(field, object, xInField, yInField);
					}
				}));
			}
			for (Future<?> task : column) {
				await(task);
			}
			long columnsDone = (long) channel * mapper.getWidth() + (u - mapper.getMinX() + 1);
			float percent = columnsDone / (float) ((long) channels * mapper.getWidth()) * 100f;
			this.progress(String.format(Locale.ROOT, "\r%.2f%% complete", percent));
		}

		DistanceResult result = DistanceResult.of(distances);
		if (logger.isDebugEnabled()) {
			logger.debug("Computed " + result + " in " + (System.currentTimeMillis() - start) + "ms");
		}
		return result;
	}

	/**
	 * Sum of absolute differences between the object and the object-sized patch of the field with its top-left corner at
	 * (xInField,yInField)
	 */
	static double l1Distance(GrayF32 field, GrayF32 object, int xInField, int yInField) {
		double error = 0.0;
		for (int yInObject = 0; yInObject < object.height; yInObject++) {
			for (int xInObject = 0; xInObject < object.width; xInObject++) {
				float vField = field.unsafe_get(xInField + xInObject, yInField + yInObject);
				float vObject = object.unsafe_get(xInObject, yInObject);
				error += Math.abs(vField - vObject);
			}
		}
		return error;
	}

	static void checkFootprint(GrayF32 field, GrayF32 object, Rectangle searchRect) {
		if (searchRect.width <= 0 || searchRect.height <= 0) {
			throw new ObjectSearchException("Search rectangle must not be empty: " + searchRect);
		}
		if (searchRect.x < 0 || searchRect.y < 0 || searchRect.x + searchRect.width + object.width - 1 > field.width
				|| searchRect.y + searchRect.height + object.height - 1 > field.height) {
			throw new ObjectSearchException("Object (" + object.width + "x" + object.height + ") placed in " + searchRect + " leaves the field ("
					+ field.width + "x" + field.height + ")");
		}
	}

	private static void await(Future<?> task) throws InterruptedException {
		try {
			task.get();
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			} else if (e.getCause() instanceof Error) {
				throw (Error) e.getCause();
			} else {
				throw new ObjectSearchException("Distance computation failed", e.getCause());
			}
		}
	}

	private void progress(String text) {
		if (this.progress != null) {
			this.progress.print(text);
			this.progress.flush();
		}
	}

}
