package org.agenticscript.runtime.api;

import java.time.Duration;

/**
 * Raised when an ask does not receive its reply within the timeout.
 */
public class AskTimeoutException extends ScriptError {

    public AskTimeoutException(String recipient, Duration timeout) {
        super(ErrorCode.TIMEOUT, "Ask to " + recipient + " timed out after " + timeout.toMillis() + " ms");
    }
}
