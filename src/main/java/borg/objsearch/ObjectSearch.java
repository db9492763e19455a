package borg.objsearch;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.io.image.ConvertBufferedImage;
import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;
import borg.objsearch.channels.ChannelPair;
import borg.objsearch.channels.ChannelPreprocessor;
import borg.objsearch.channels.ColorMode;
import borg.objsearch.templatematching.ChannelCombiner;
import borg.objsearch.templatematching.CombineMode;
import borg.objsearch.templatematching.DistanceEngine;
import borg.objsearch.templatematching.DistanceResult;
import borg.objsearch.templatematching.Hit;
import borg.objsearch.templatematching.HitExtractor;
import borg.objsearch.templatematching.IndexMapper;

/**
 * Finds occurrences of an object image inside a field image by comparing the object against the field at every offset
 * of a search rectangle.
 */
public class ObjectSearch {

	static final Logger logger = LoggerFactory.getLogger(ObjectSearch.class);

	/**
	 * @param field
	 *            RGB, raw 8-bit values
	 * @param object
	 *            RGB, raw 8-bit values, not larger than the field
	 * @param searchRect
	 *            Top-left corners of the object to test
	 * @param tolerance
	 *            Only scores below this value are hits
	 * @param minSeparation
	 *            Hits closer than this (Chebyshev) are merged into the better one
	 * @param progress
	 *            Receives textual progress, may be <code>null</code>
	 * @return Hits sorted by score, best first
	 * @throws ObjectSearchException
	 *             If the search cannot be performed with the given parameters
	 */
	public static List<Hit> search(Planar<GrayF32> field, Planar<GrayF32> object, Rectangle searchRect, double tolerance, int minSeparation,
			PrintStream progress, ColorMode colorMode, CombineMode combineMode) throws InterruptedException {
		SearchSettings settings = new SearchSettings();
		settings.setTolerance(tolerance);
		settings.setMinSeparation(minSeparation);
		settings.setColorMode(colorMode);
		settings.setCombineMode(combineMode);
		return search(field, object, searchRect, settings, progress);
	}

	public static List<Hit> search(Planar<GrayF32> field, Planar<GrayF32> object, Rectangle searchRect, SearchSettings settings, PrintStream progress)
			throws InterruptedException {
		return search(new SearchContext(field, object, searchRect, settings, progress));
	}

	public static List<Hit> search(BufferedImage field, BufferedImage object, Rectangle searchRect, SearchSettings settings, PrintStream progress)
			throws InterruptedException {
		Planar<GrayF32> fieldRgb = ConvertBufferedImage.convertFromPlanar(field, (Planar<GrayF32>) null, true, GrayF32.class);
		Planar<GrayF32> objectRgb = ConvertBufferedImage.convertFromPlanar(object, (Planar<GrayF32>) null, true, GrayF32.class);
		return search(fieldRgb, objectRgb, searchRect, settings, progress);
	}

	public static List<Hit> search(SearchContext ctx) throws InterruptedException {
		ctx.validate();

		final long start = System.currentTimeMillis();
		final Rectangle searchRect = ctx.getSearchRect();
		logger.debug("Searching " + ctx.getObject().width + "x" + ctx.getObject().height + " object in " + ctx.getField().width + "x" + ctx.getField().height
				+ " field, offsets " + searchRect + ", " + ctx.getColorMode() + "/" + ctx.getCombineMode());

		List<ChannelPair> channels = ChannelPreprocessor.toChannels(ctx.getField(), ctx.getObject(), ctx.getColorMode());

		List<DistanceResult> results = new ArrayList<>(channels.size());
		ExecutorService threadPool = Executors.newFixedThreadPool(ctx.getThreads());
		try {
			DistanceEngine engine = new DistanceEngine(threadPool, ctx.getProgress());
			progress(ctx.getProgress(), "\n");
			for (int c = 0; c < channels.size(); c++) {
				ChannelPair channel = channels.get(c);
				logger.debug("Computing distances for channel " + channel);
				results.add(engine.computeDistances(channel.getField(), channel.getObject(), searchRect, c, channels.size()));
			}
			progress(ctx.getProgress(), "\n");
		} finally {
			threadPool.shutdownNow();
		}

		DistanceResult combined = ChannelCombiner.combine(results, ctx.getCombineMode());
		List<Hit> hits = new HitExtractor(new IndexMapper(searchRect)).findHits(combined, ctx.getTolerance(), ctx.getMinSeparation());

		logger.debug("Found " + hits.size() + " hit(s) in " + (System.currentTimeMillis() - start) + "ms");
		return hits;
	}

	private static void progress(PrintStream progress, String text) {
		if (progress != null) {
			progress.print(text);
			progress.flush();
		}
	}

	/**
	 * All offsets at which an object of the given size stays completely inside the field
	 */
	public static Rectangle fullSearchRect(int fieldWidth, int fieldHeight, int objectWidth, int objectHeight) {
		return new Rectangle(0, 0, fieldWidth - objectWidth + 1, fieldHeight - objectHeight + 1);
	}

}
