package org.dxworks.jsxframe.model;

public class DropdownInfo {
    public String name;
    public String route; // C# text of the route reference, null when not a member expression

    public DropdownInfo(String name, String route) {
        this.name = name;
        this.route = route;
    }
}
