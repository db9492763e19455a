package borg.objsearch.channels;

import java.util.ArrayList;
import java.util.List;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;
import borg.objsearch.ObjectSearchException;
import borg.objsearch.util.ImageUtil;

/**
 * Splits field and object into aligned single-channel planes. Channel i of the field always pairs with channel i of
 * the object.
 */
public class ChannelPreprocessor {

	private static final String[] RGB_NAMES = { "red", "green", "blue" };

	/**
	 * @param field
	 *            At least 3 bands (RGB), raw 8-bit values
	 * @param object
	 *            At least 3 bands (RGB), raw 8-bit values
	 */
	public static List<ChannelPair> toChannels(Planar<GrayF32> field, Planar<GrayF32> object, ColorMode colorMode) {
		if (colorMode == null) {
			throw new ObjectSearchException("Unsupported color mode: null");
		}

		List<ChannelPair> result = new ArrayList<>();
		switch (colorMode) {
		case GRAYSCALE:
			result.add(new ChannelPair("gray", ImageUtil.normalize255(ImageUtil.luminance(field)), ImageUtil.normalize255(ImageUtil.luminance(object))));
			break;
		case RGB:
			Planar<GrayF32> normalizedField = ImageUtil.normalize255(field);
			Planar<GrayF32> normalizedObject = ImageUtil.normalize255(object);
			for (int band = 0; band < RGB_NAMES.length; band++) {
				result.add(new ChannelPair(RGB_NAMES[band], normalizedField.getBand(band), normalizedObject.getBand(band)));
			}
			break;
		default:
			throw new ObjectSearchException("Unsupported color mode: " + colorMode);
		}
		return result;
	}

}
