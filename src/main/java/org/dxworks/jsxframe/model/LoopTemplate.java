package org.dxworks.jsxframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoopTemplate {
    public String stateKey;
    public String arrayBinding;
    public String itemVar;
    public String indexVar;
    public String keyBinding;
    public ItemTemplate itemTemplate;
}
