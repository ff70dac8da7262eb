package com.piperplatform.common.state;

/**
 * Fixed deltas applied by {@link StateEngine}.
 */
final class StateModifiers {

    // event deltas
    static final double CORRECT_ENGAGEMENT        = +1.0;
    static final double CORRECT_DYSREGULATION     = -0.5;
    static final double INCORRECT_ENGAGEMENT      = -0.5;
    static final double TRIPLE_REPEAT_DYSREGULATION = +2.0;
    static final double INACTIVE_ENGAGEMENT       = -2.0;

    // signal deltas
    static final double SCREAMING_DYSREGULATION   = +4.0;
    static final double CRYING_DYSREGULATION      = +3.0;
    static final double DISTRESS_DYSREGULATION    = +2.0;
    static final double FRUSTRATION_DYSREGULATION = +1.0;
    static final double WANTS_QUIT_ENGAGEMENT     = -2.0;
    static final double WANTS_BREAK_FATIGUE       = +1.0;

    // break taken
    static final double BREAK_DYSREGULATION       = -2.0;
    static final double BREAK_FATIGUE             = -2.0;

    static final long ERROR_WINDOW_SECONDS = 60;

    private StateModifiers() {}
}
