package org.dxworks.jsxframe.model;

public class PaginatedTaskInfo {
    public String name;
    public String fetchTaskName;
    public String countTaskName;
    public int pageSize;
    public String runtime;
    public boolean parallel;

    public PaginatedTaskInfo(String name, String fetchTaskName, String countTaskName, int pageSize,
                             String runtime, boolean parallel) {
        this.name = name;
        this.fetchTaskName = fetchTaskName;
        this.countTaskName = countTaskName;
        this.pageSize = pageSize;
        this.runtime = runtime;
        this.parallel = parallel;
    }
}
