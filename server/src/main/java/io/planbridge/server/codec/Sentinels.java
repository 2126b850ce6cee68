package io.planbridge.server.codec;

/**
 * Marker values the deployment engine uses inside otherwise plain JSON-like payloads.
 *  - an Unknown value travels as the string {@link #UNKNOWN};
 *  - a secret travels as an object holding {@link #SIG_KEY}: {@link #SECRET_SIG} and the
 *    wrapped payload under {@link #VALUE_KEY}.
 */
public final class Sentinels {

    public static final String UNKNOWN = "04da6b54-80e4-46f7-96ec-b56ff0331ba9";
    public static final String SIG_KEY = "4dabf18193072939515e22adb298388d";
    public static final String SECRET_SIG = "1b47061264138c4ac30d75fd1eb44270";
    public static final String VALUE_KEY = "value";

    private Sentinels() {}
}
