package borg.objsearch.channels;

/**
 * Which single-channel planes are derived from the color images before searching
 */
public enum ColorMode {

	/** One plane, the luminance */
	GRAYSCALE,

	/** Three planes: red, green, blue */
	RGB;

}
