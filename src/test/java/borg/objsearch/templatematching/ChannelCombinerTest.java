package borg.objsearch.templatematching;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import borg.objsearch.ObjectSearchException;

class ChannelCombinerTest {

	private final List<DistanceResult> channels = Arrays.asList( //
			DistanceResult.of(new double[] { 1.0, 5.0, 2.0, 0.0 }), //
			DistanceResult.of(new double[] { 3.0, 1.0, 2.0, 0.5 }), //
			DistanceResult.of(new double[] { 2.0, 0.0, 8.0, 0.5 }));

	@Test
	void maxTakesWorstChannel() {
		DistanceResult combined = ChannelCombiner.combine(channels, CombineMode.MAX);

		assertArrayEquals(new double[] { 3.0, 5.0, 8.0, 0.5 }, combined.toArray());
		// Neither the smallest per-channel minimum nor the largest per-channel maximum
		assertEquals(0.5, combined.getMin());
		assertEquals(8.0, combined.getMax());
	}

	@Test
	void minTakesBestChannel() {
		DistanceResult combined = ChannelCombiner.combine(channels, CombineMode.MIN);

		assertArrayEquals(new double[] { 1.0, 0.0, 2.0, 0.0 }, combined.toArray());
		assertEquals(0.0, combined.getMin());
		assertEquals(2.0, combined.getMax());
	}

	@Test
	void meanAveragesChannels() {
		DistanceResult combined = ChannelCombiner.combine(channels, CombineMode.MEAN);

		assertArrayEquals(new double[] { 2.0, 2.0, 4.0, 1.0 / 3.0 }, combined.toArray(), 1e-12);
		assertEquals(1.0 / 3.0, combined.getMin(), 1e-12);
		assertEquals(4.0, combined.getMax(), 1e-12);
	}

	@Test
	void singleChannelIsUnchanged() {
		DistanceResult gray = DistanceResult.of(new double[] { 4.0, 2.0, 6.0 });

		DistanceResult combined = ChannelCombiner.combine(Collections.singletonList(gray), CombineMode.MAX);

		assertArrayEquals(gray.toArray(), combined.toArray());
		assertEquals(2.0, combined.getMin());
		assertEquals(6.0, combined.getMax());
	}

	@Test
	void channelsMustHaveSameLength() {
		List<DistanceResult> mismatched = Arrays.asList(DistanceResult.of(new double[] { 1.0, 2.0 }), DistanceResult.of(new double[] { 1.0, 2.0, 3.0 }));

		assertThrows(ObjectSearchException.class, () -> ChannelCombiner.combine(mismatched, CombineMode.MAX));
	}

	@Test
	void missingModeOrChannelsAreRejected() {
		assertThrows(ObjectSearchException.class, () -> ChannelCombiner.combine(channels, null));
		assertThrows(ObjectSearchException.class, () -> ChannelCombiner.combine(Collections.<DistanceResult> emptyList(), CombineMode.MAX));
	}

}
