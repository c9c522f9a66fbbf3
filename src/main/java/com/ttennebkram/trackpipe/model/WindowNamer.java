package com.ttennebkram.trackpipe.model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out "Step N" names for windows created without a name.
 *
 * The shared instance lives for the whole process: it starts at 1, advances
 * once per unnamed Window and is never reset. Tests create their own
 * instance to get predictable numbering.
 */
public final class WindowNamer {

    private static final WindowNamer SHARED = new WindowNamer();

    private final AtomicInteger counter = new AtomicInteger(1);

    public static WindowNamer shared() {
        return SHARED;
    }

    public String nextName() {
        return "Step " + counter.getAndIncrement();
    }
}
