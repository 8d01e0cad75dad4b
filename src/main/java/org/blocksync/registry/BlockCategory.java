package org.blocksync.registry;

/**
 * Toolbox categories in display order.
 */
public enum BlockCategory {
    BASIC("Basic", "#1E90FF"),
    INPUT("Input", "#D400D4"),
    LOOPS("Loops", "#00AA00"),
    LED("Led", "#5C2D91"),
    LOGIC("Logic", "#00A4A6"),
    VARIABLES("Variables", "#DC143C"),
    TEXT("Text", "#B8860B"),
    MATHS("Maths", "#9400D3"),
    MUSIC("Music", "#E63022"),
    PINS("Pins", "#B22222"),
    /** Kinds the engine creates itself; never shown in a toolbox. */
    INTERNAL("Internal", "#888888");

    private final String displayName;
    private final String colour;

    BlockCategory(String displayName, String colour) {
        this.displayName = displayName;
        this.colour = colour;
    }

    public String displayName() {
        return displayName;
    }

    public String colour() {
        return colour;
    }

    public boolean isVisible() {
        return this != INTERNAL;
    }
}
