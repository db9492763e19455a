package borg.objsearch;

import java.util.Random;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;

/**
 * Random RGB images with raw 8-bit values
 */
public abstract class TestImages {

	public static Planar<GrayF32> randomRgb(Random random, int width, int height) {
		Planar<GrayF32> rgb = new Planar<>(GrayF32.class, width, height, 3);
		for (int band = 0; band < 3; band++) {
			GrayF32 pixels = rgb.getBand(band);
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					pixels.unsafe_set(x, y, random.nextInt(256));
				}
			}
		}
		return rgb;
	}

	public static Planar<GrayF32> uniformRgb(int width, int height, int r, int g, int b) {
		Planar<GrayF32> rgb = new Planar<>(GrayF32.class, width, height, 3);
		int[] values = { r, g, b };
		for (int band = 0; band < 3; band++) {
			GrayF32 pixels = rgb.getBand(band);
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					pixels.unsafe_set(x, y, values[band]);
				}
			}
		}
		return rgb;
	}

	/**
	 * Copies the object into the field with its top-left corner at (x,y), overwriting what was there
	 */
	public static void paste(Planar<GrayF32> object, Planar<GrayF32> field, int x, int y) {
		for (int band = 0; band < object.getNumBands(); band++) {
			GrayF32 from = object.getBand(band);
			GrayF32 to = field.getBand(band);
			for (int yInObject = 0; yInObject < object.height; yInObject++) {
				for (int xInObject = 0; xInObject < object.width; xInObject++) {
					to.unsafe_set(x + xInObject, y + yInObject, from.unsafe_get(xInObject, yInObject));
				}
			}
		}
	}

	public static GrayF32 randomGray(Random random, int width, int height) {
		GrayF32 gray = new GrayF32(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				gray.unsafe_set(x, y, random.nextInt(256) / 255f);
			}
		}
		return gray;
	}

}
