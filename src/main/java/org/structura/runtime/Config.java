package org.structura.runtime;

/**
 * Provides centralized default settings for the Structura execution core.
 * This final class contains static constants used when no {@link EngineOptions}
 * are supplied from HOCON configuration. It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The maximum number of steps a single plan may contain.
     */
    public static final int DEFAULT_MAX_PLAN_STEPS = 1000;

    /**
     * The maximum number of values an initial configuration may declare.
     */
    public static final int DEFAULT_MAX_ELEMENTS = 256;

    /**
     * The prefix for generated element identifiers (n0, n1, ...).
     */
    public static final String DEFAULT_ID_PREFIX = "n";

    /**
     * Slot value used by list nodes, which have no physical position.
     */
    public static final int NO_SLOT = -1;

    /**
     * Top index of an empty stack.
     */
    public static final int EMPTY_STACK_TOP = -1;

    // Parameter keys understood by the transform library.
    public static final String PARAM_VALUE = "value";
    public static final String PARAM_POSITION = "position";
    public static final String PARAM_FROM = "from";
    public static final String PARAM_TO = "to";

    /**
     * Literal used in SET_NEXT / SET_PREV to clear a link.
     */
    public static final String NULL_LINK = "null";

    /**
     * Symbolic references accepted by SET_NEXT / SET_PREV in place of an element id.
     */
    public static final String REF_HEAD = "head";
    public static final String REF_TAIL = "tail";
}
