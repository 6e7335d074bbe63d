package warden.core.model.auth;

import warden.core.model.session.DeviceInfo;

/**
 * Request-derived information recorded with a login.
 */
public record ClientContext(String ipAddress, DeviceInfo deviceInfo) {

    public static ClientContext unknown() {
        return new ClientContext("unknown", DeviceInfo.empty());
    }
}
