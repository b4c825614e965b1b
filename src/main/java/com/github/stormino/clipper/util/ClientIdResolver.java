package com.github.stormino.clipper.util;

import jakarta.servlet.http.HttpServletRequest;
import lombok.experimental.UtilityClass;

/**
 * Resolves the identity rate limits are applied to.
 */
@UtilityClass
public class ClientIdResolver {

    /**
     * Explicit client id when given, otherwise the request's origin address,
     * honouring the common proxy headers.
     */
    public static String resolve(String explicitClientId, HttpServletRequest request) {
        if (explicitClientId != null && !explicitClientId.isBlank()) {
            return explicitClientId.trim();
        }
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
