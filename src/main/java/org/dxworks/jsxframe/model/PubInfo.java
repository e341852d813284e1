package org.dxworks.jsxframe.model;

public class PubInfo {
    public String name;
    public String channel;

    public PubInfo(String name, String channel) {
        this.name = name;
        this.channel = channel;
    }
}
