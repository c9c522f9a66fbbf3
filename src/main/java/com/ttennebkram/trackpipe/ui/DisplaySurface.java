package com.ttennebkram.trackpipe.ui;

/**
 * Named surfaces that show images, one per pipeline window.
 *
 * @param <I> image buffer type
 */
public interface DisplaySurface<I> {

    void createSurface(String name, SurfaceOptions options);

    /**
     * Show {@code image} on the surface {@code name}. A null image leaves the
     * surface as it is.
     */
    void show(String name, I image);

    /**
     * Whether the surface is still open on screen.
     */
    boolean isVisible(String name);

    /**
     * Close every surface created so far.
     */
    void destroyAllSurfaces();
}
