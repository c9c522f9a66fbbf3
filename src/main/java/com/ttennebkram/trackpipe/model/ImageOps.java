package com.ttennebkram.trackpipe.model;

/**
 * The two buffer operations the engine needs from the image type.
 *
 * @param <I> image buffer type
 */
public interface ImageOps<I> {

    /**
     * Independent copy of {@code image}, so transforms cannot modify the
     * caller's source in place. A null image copies to null.
     */
    I copy(I image);

    /**
     * Convert {@code image} into something a display surface can show
     * (e.g. 8-bit pixels). May return the argument unchanged; null stays null.
     */
    I toDisplayable(I image);
}
