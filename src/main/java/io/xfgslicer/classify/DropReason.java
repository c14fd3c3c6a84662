package io.xfgslicer.classify;

/**
 * Why a classification candidate produced no key line.
 */
public enum DropReason {
    /** Neither the node nor any node before it carries a location. */
    NO_LOCATION,
    /** A location was present on the way back but could not be read as {@code line:column}. */
    MALFORMED_LOCATION,
    /** Call expression without a callee name in the following node. */
    CALLEE_MISSING
}
