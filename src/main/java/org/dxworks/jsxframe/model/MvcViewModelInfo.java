package org.dxworks.jsxframe.model;

public class MvcViewModelInfo {
    public String name;

    public MvcViewModelInfo(String name) {
        this.name = name;
    }
}
