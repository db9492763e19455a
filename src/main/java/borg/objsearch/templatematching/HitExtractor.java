package borg.objsearch.templatematching;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import borg.objsearch.ObjectSearchException;

/**
 * Turns distances into scored hits: normalize, threshold, then merge hits that are too close to each other.
 */
public class HitExtractor {

	static final Logger logger = LoggerFactory.getLogger(HitExtractor.class);

	private final IndexMapper mapper;

	public HitExtractor(IndexMapper mapper) {
		this.mapper = mapper;
	}

	public List<Hit> findHits(DistanceResult distances, double tolerance, int minSeparation) {
		return this.findHits(distances.distances(), distances.getMin(), distances.getMax(), tolerance, minSeparation);
	}

	/**
	 * A distance equal to min scores 0, a distance equal to max scores 1. Only scores strictly below the tolerance become
	 * hits. Of two hits with a Chebyshev distance below minSeparation only the better one is kept.
	 *
	 * @return Hits sorted by score, best first
	 */
	public List<Hit> findHits(double[] distances, double min, double max, double tolerance, int minSeparation) {
		if (max <= min) {
			throw new ObjectSearchException("Cannot normalize distances, max (" + max + ") <= min (" + min + ")");
		}
		if (distances.length != this.mapper.size()) {
			throw new ObjectSearchException("Expected " + this.mapper.size() + " distances but got " + distances.length);
		}

		final double range = max - min;
		List<Hit> hits = new ArrayList<>();
		int candidates = 0;
		nextCandidate: for (int i = 0; i < distances.length; i++) {
			double score = (distances[i] - min) / range;
			if (score < tolerance) {
				candidates++;
				Hit candidate = new Hit(this.mapper.x(i), this.mapper.y(i), score);
				for (int j = 0; j < hits.size(); j++) {
					if (hits.get(j).distance(candidate) < minSeparation) {
						// Same detection, keep the better one
						if (candidate.getScore() < hits.get(j).getScore()) {
							hits.set(j, candidate);
						}
						continue nextCandidate;
					}
				}
				hits.add(candidate);
			}
		}

		hits.sort(Comparator.comparingDouble(Hit::getScore));
		logger.debug(candidates + " candidate(s) below " + tolerance + " merged into " + hits.size() + " hit(s)");
		return hits;
	}

}
