package com.libsl.loader.ast;

import com.libsl.asg.LslVersion;
import java.util.Objects;

public final class HeaderNode {
    private final SourceLocation location;
    private final String name;
    private final LslVersion lslVersion;
    private final String libraryVersion;
    private final String language;
    private final String url;

    public HeaderNode(
            SourceLocation location,
            String name,
            LslVersion lslVersion,
            String libraryVersion,
            String language,
            String url) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.lslVersion = lslVersion;
        this.libraryVersion = libraryVersion;
        this.language = language;
        this.url = url;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public LslVersion getLslVersion() {
        return lslVersion;
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
}
