package borg.objsearch.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;
import borg.objsearch.TestImages;

class ImageUtilTest {

	@Test
	void luminanceWeightsRedGreenBlue() {
		assertEquals(76.245f, ImageUtil.luminance(TestImages.uniformRgb(2, 2, 255, 0, 0)).get(1, 1), 1e-3f);
		assertEquals(149.685f, ImageUtil.luminance(TestImages.uniformRgb(2, 2, 0, 255, 0)).get(0, 1), 1e-3f);
		assertEquals(29.07f, ImageUtil.luminance(TestImages.uniformRgb(2, 2, 0, 0, 255)).get(1, 0), 1e-3f);
		assertEquals(255f, ImageUtil.luminance(TestImages.uniformRgb(2, 2, 255, 255, 255)).get(0, 0), 1e-3f);
		assertEquals(0f, ImageUtil.luminance(TestImages.uniformRgb(2, 2, 0, 0, 0)).get(0, 0), 1e-3f);
	}

	@Test
	void luminanceIgnoresExtraBands() {
		Planar<GrayF32> rgba = new Planar<>(GrayF32.class, 2, 2, 4);
		rgba.getBand(1).set(0, 0, 255f);
		rgba.getBand(3).set(0, 0, 255f);

		assertEquals(149.685f, ImageUtil.luminance(rgba).get(0, 0), 1e-3f);
	}

	@Test
	void normalize255DividesEveryBand() {
		Planar<GrayF32> normalized = ImageUtil.normalize255(TestImages.uniformRgb(3, 2, 255, 51, 0));

		assertEquals(3, normalized.getNumBands());
		assertEquals(1f, normalized.getBand(0).get(2, 1));
		assertEquals(0.2f, normalized.getBand(1).get(0, 0), 1e-6f);
		assertEquals(0f, normalized.getBand(2).get(1, 1));
	}

	@Test
	void normalize255WorksOnSubimages() {
		GrayF32 gray = new GrayF32(4, 4);
		gray.set(3, 3, 255f);

		GrayF32 normalized = ImageUtil.normalize255(gray.subimage(2, 2, 4, 4));

		assertEquals(2, normalized.width);
		assertEquals(1f, normalized.get(1, 1));
		assertEquals(0f, normalized.get(0, 0));
	}

}
