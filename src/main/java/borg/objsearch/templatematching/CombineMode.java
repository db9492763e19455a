package borg.objsearch.templatematching;

/**
 * How per-channel distances are merged into one distance per offset
 */
public enum CombineMode {

	/** Worst channel wins, an offset is only close if all channels are close */
	MAX,

	/** Arithmetic mean over all channels */
	MEAN,

	/** Best channel wins */
	MIN;

}
