package borg.objsearch.channels;

import boofcv.struct.image.GrayF32;

/**
 * The same channel of field and object, both normalized to [0,1]
 */
public class ChannelPair {

	private final String name;
	private final GrayF32 field;
	private final GrayF32 object;

	public ChannelPair(String name, GrayF32 field, GrayF32 object) {
		this.name = name;
		this.field = field;
		this.object = object;
	}

	public String getName() {
		return name;
	}

	public GrayF32 getField() {
		return field;
	}

	public GrayF32 getObject() {
		return object;
	}

	@Override
	public String toString() {
		return this.name + " (" + this.field.width + "x" + this.field.height + " / " + this.object.width + "x" + this.object.height + ")";
	}

}
