package borg.objsearch.templatematching;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.awt.Point;

import org.junit.jupiter.api.Test;

class HitTest {

	@Test
	void distanceIsLargerOfXAndYDistance() {
		Hit a = new Hit(20, 30, 0.1);
		assertEquals(6, a.distance(new Hit(26, 36, 0.0)));
		assertEquals(9, a.distance(new Hit(11, 33, 0.0)));
		assertEquals(4, a.distance(new Hit(21, 26, 0.0)));
		assertEquals(0, a.distance(a));
	}

	@Test
	void equalityIncludesScore() {
		assertEquals(new Hit(new Point(2, 2), 0.05), new Hit(2, 2, 0.05));
		assertEquals(new Hit(2, 2, 0.05).hashCode(), new Hit(2, 2, 0.05).hashCode());
		assertNotEquals(new Hit(2, 2, 0.05), new Hit(2, 2, 0.06));
		assertNotEquals(new Hit(2, 2, 0.05), new Hit(2, 3, 0.05));
	}

	@Test
	void locationIsACopy() {
		Hit hit = new Hit(3, 4, 0.5);
		hit.getLocation().translate(10, 10);
		assertEquals(new Point(3, 4), hit.getLocation());
		assertEquals("3/4 0.5000", hit.toString());
	}

}
