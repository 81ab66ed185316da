package net.spookly.gsdk.config;

/**
 * Well-known keys in the agent config settings map.
 */
public final class ConfigKeys {
    public static final String HEARTBEAT_ENDPOINT = "gsmsBaseUrl";
    public static final String SERVER_ID = "instanceId";
    public static final String LOG_FOLDER = "logFolder";
    public static final String SHARED_CONTENT_FOLDER = "sharedContentFolder";
    public static final String CERTIFICATE_FOLDER = "certificateFolder";
    public static final String TITLE_ID = "titleId";
    public static final String BUILD_ID = "buildId";
    public static final String REGION = "region";
    public static final String PUBLIC_IP_V4_ADDRESS = "publicIpV4Address";
    public static final String FULLY_QUALIFIED_DOMAIN_NAME = "fullyQualifiedDomainName";

    /** Session config key pushed by the orchestrator once the server is allocated. */
    public static final String SESSION_COOKIE = "sessionCookie";
    /** Session config key pushed by the orchestrator once the server is allocated. */
    public static final String SESSION_ID = "sessionId";

    private ConfigKeys() {
    }
}
