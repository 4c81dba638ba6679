package io.chronr.query.func;

public enum OutputShape {
    /** At most one point per series. */
    SINGLE_SCALAR,
    /** Any number of points per series. */
    MULTI_POINT,
}
