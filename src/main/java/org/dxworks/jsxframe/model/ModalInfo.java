package org.dxworks.jsxframe.model;

public class ModalInfo {
    public String name;

    public ModalInfo(String name) {
        this.name = name;
    }
}
