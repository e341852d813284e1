package org.dxworks.jsxframe.model;

public class SubInfo {
    public String name;
    public String channel;
    public boolean hasCallback;

    public SubInfo(String name, String channel, boolean hasCallback) {
        this.name = name;
        this.channel = channel;
        this.hasCallback = hasCallback;
    }
}
