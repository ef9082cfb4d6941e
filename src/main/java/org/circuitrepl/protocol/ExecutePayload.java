package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutePayload(String code, ExecutionMode mode, Boolean enableHardwareMonitoring) {

    public ExecutionMode effectiveMode() {
        return mode == null ? ExecutionMode.REPL : mode;
    }

    public boolean hardwareMonitoring() {
        return enableHardwareMonitoring == null || enableHardwareMonitoring;
    }
}
