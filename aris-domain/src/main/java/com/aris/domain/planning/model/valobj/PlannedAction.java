package com.aris.domain.planning.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 规划器输出的单个动作草稿。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlannedAction {

    /** 规划器给出的符号 ID，可空 */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;

    private String resultVariableName;
}
