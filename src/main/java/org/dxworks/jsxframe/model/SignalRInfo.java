package org.dxworks.jsxframe.model;

public class SignalRInfo {
    public String name;
    public String hubUrl;
    public boolean hasOnMessage;

    public SignalRInfo(String name, String hubUrl, boolean hasOnMessage) {
        this.name = name;
        this.hubUrl = hubUrl;
        this.hasOnMessage = hasOnMessage;
    }
}
