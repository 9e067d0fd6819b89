package com.libsl.asg;

import java.util.Objects;

public final class MetaNode extends Node {
    private final String name;
    private final String libraryVersion;
    private final String language;
    private final String url;
    private final LslVersion lslVersion;

    public MetaNode(String name, String libraryVersion, String language, String url, LslVersion lslVersion) {
        this.name = Objects.requireNonNull(name, "name");
        this.libraryVersion = libraryVersion;
        this.language = language;
        this.url = url;
        this.lslVersion = lslVersion;
    }

    public String getName() {
        return name;
    }

    public String getLibraryVersion() {
        return libraryVersion;
    }

    public String getLanguage() {
        return language;
    }

    public String getUrl() {
        return url;
    }

    public LslVersion getLslVersion() {
        return lslVersion;
    }

    /** {@code major.minor.patch}, or {@code null} when the header declares no language version. */
    public String getStringVersion() {
        return lslVersion == null ? null : lslVersion.toString();
    }
}
