package warden.core.model.session;

/**
 * Client device description captured at login.
 *
 * @param userAgent      raw User-Agent header
 * @param acceptLanguage raw Accept-Language header
 * @param fingerprint    short digest of the user agent
 */
public record DeviceInfo(String userAgent, String acceptLanguage, String fingerprint) {

    public DeviceInfo {
        userAgent = userAgent == null ? "" : userAgent;
        acceptLanguage = acceptLanguage == null ? "" : acceptLanguage;
        fingerprint = fingerprint == null ? "" : fingerprint;
    }

    public static DeviceInfo empty() {
        return new DeviceInfo("", "", "");
    }
}
