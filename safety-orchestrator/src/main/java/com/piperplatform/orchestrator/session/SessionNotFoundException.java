package com.piperplatform.orchestrator.session;

import com.piperplatform.common.exception.SafetyGateException;

public class SessionNotFoundException extends SafetyGateException {

    public SessionNotFoundException(String sessionId) {
        super("SessionRegistry", "No open session: " + sessionId);
    }
}
