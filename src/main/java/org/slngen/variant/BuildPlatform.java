package org.slngen.variant;

import java.util.Locale;

/**
 * Target platforms a variant can be prepared for.
 */
public enum BuildPlatform {
    IOS("ios", "iOS", "UNITY_IOS"),
    ANDROID("android", "Android", "UNITY_ANDROID");

    private final String cliName;
    private final String unityName;
    private final String define;

    BuildPlatform(String cliName, String unityName, String define) {
        this.cliName = cliName;
        this.unityName = unityName;
        this.define = define;
    }

    /** Name used on the command line and in variant suffixes. */
    public String cliName() {
        return cliName;
    }

    /** Name used in declaration platform lists. */
    public String unityName() {
        return unityName;
    }

    /** The scripting define identifying this platform. */
    public String define() {
        return define;
    }

    public static BuildPlatform fromCliName(String value) {
        for (BuildPlatform platform : values()) {
            if (platform.cliName.equals(value.toLowerCase(Locale.ROOT))) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform '" + value + "' (expected ios or android)");
    }
}
