package borg.objsearch.util;

import boofcv.alg.color.ColorRgb;
import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;

public abstract class ImageUtil {

	/**
	 * Hard division by 255. Multiple invocations will again divide by 255.
	 */
	public static GrayF32 normalize255(GrayF32 original) {
		GrayF32 normalized = new GrayF32(original.width, original.height);
		for (int y = 0; y < original.height; y++) {
			for (int x = 0; x < original.width; x++) {
				normalized.unsafe_set(x, y, original.unsafe_get(x, y) / 255f);
			}
		}
		return normalized;
	}

	/**
	 * Hard division by 255. Multiple invocations will again divide by 255.
	 */
	public static Planar<GrayF32> normalize255(Planar<GrayF32> original) {
		Planar<GrayF32> normalized = new Planar<>(GrayF32.class, original.width, original.height, original.getNumBands());
		for (int band = 0; band < original.getNumBands(); band++) {
			normalized.setBand(band, ImageUtil.normalize255(original.getBand(band)));
		}
		return normalized;
	}

	/**
	 * Weighted luminance (0.299 R + 0.587 G + 0.114 B) of the first three bands, same value range as the input.
	 */
	public static GrayF32 luminance(Planar<GrayF32> rgb) {
		Planar<GrayF32> bands = rgb.getNumBands() == 3 ? rgb : rgb.partialSpectrum(0, 1, 2);
		GrayF32 gray = new GrayF32(rgb.width, rgb.height);
		ColorRgb.rgbToGray_Weighted(bands, gray);
		return gray;
	}

}
