package com.metocean.report.model;

import java.util.List;

/**
 * 处理器元数据，描述处理器的身份、版本和参数定义
 */
public class ProcessorMetadata {
    private String processorId;
    private String name;
    private String version;
    private String description;
    private List<ParameterDefinition> parameterDefinitions;

    public ProcessorMetadata() {}

    public String getProcessorId() { return processorId; }
    public void setProcessorId(String processorId) { this.processorId = processorId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public List<ParameterDefinition> getParameterDefinitions() { return parameterDefinitions; }
    public void setParameterDefinitions(List<ParameterDefinition> parameterDefinitions) { this.parameterDefinitions = parameterDefinitions; }
}
