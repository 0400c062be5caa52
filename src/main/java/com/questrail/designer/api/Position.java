package com.questrail.designer.api;

/**
 * Canvas position of a node. Carried for the editor only; it takes no part in
 * configuration generation or graph equivalence.
 */
public record Position(double x, double y)
{
    public static final Position ORIGIN = new Position(0, 0);

    public static Position of(double x, double y) {
        return new Position(x, y);
    }
}
