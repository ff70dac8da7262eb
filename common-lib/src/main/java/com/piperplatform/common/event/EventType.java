package com.piperplatform.common.event;

public enum EventType {
    /** The child said something in reply to the current card. */
    RESPONSE_RECEIVED,
    /** The session's inactivity timer fired. */
    INACTIVITY_FIRED
}
