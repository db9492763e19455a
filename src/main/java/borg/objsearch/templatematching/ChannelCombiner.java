package borg.objsearch.templatematching;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import borg.objsearch.ObjectSearchException;

/**
 * Merges per-channel distances into one distance per offset. Min and max of the result are always recomputed from the
 * combined distances.
 */
public class ChannelCombiner {

	static final Logger logger = LoggerFactory.getLogger(ChannelCombiner.class);

	public static DistanceResult combine(List<DistanceResult> channels, CombineMode mode) {
		if (mode == null) {
			throw new ObjectSearchException("Unsupported combine mode: null");
		}
		if (channels.isEmpty()) {
			throw new ObjectSearchException("No channels to combine");
		}
		final int size = channels.get(0).size();
		for (DistanceResult channel : channels) {
			if (channel.size() != size) {
				throw new ObjectSearchException("Channel sizes differ: " + channel.size() + " vs " + size);
			}
		}

		double[] combined = new double[size];
		switch (mode) {
		case MAX:
			for (int i = 0; i < size; i++) {
				double d = channels.get(0).getDistance(i);
				for (int c = 1; c < channels.size(); c++) {
					d = Math.max(d, channels.get(c).getDistance(i));
				}
				combined[i] = d;
			}
			break;
		case MIN:
			for (int i = 0; i < size; i++) {
				double d = channels.get(0).getDistance(i);
				for (int c = 1; c < channels.size(); c++) {
					d = Math.min(d, channels.get(c).getDistance(i));
				}
				combined[i] = d;
			}
			break;
		case MEAN:
			for (int i = 0; i < size; i++) {
				double sum = 0.0;
				for (int c = 0; c < channels.size(); c++) {
					sum += channels.get(c).getDistance(i);
				}
				combined[i] = sum / channels.size();
			}
			break;
		default:
			throw new ObjectSearchException("Unsupported combine mode: " + mode);
		}

		DistanceResult result = DistanceResult.of(combined);
		logger.debug("Combined " + channels.size() + " channel(s) using " + mode + " into " + result);
		return result;
	}

}
