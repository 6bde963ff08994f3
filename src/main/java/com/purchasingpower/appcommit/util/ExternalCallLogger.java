package com.purchasingpower.appcommit.util;

import com.purchasingpower.appcommit.model.CallContext;
import com.purchasingpower.appcommit.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging entry point for calls leaving the process (GitHub, local git).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (response bodies can be big)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
