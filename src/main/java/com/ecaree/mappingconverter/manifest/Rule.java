package com.ecaree.mappingconverter.manifest;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 库下载规则
 * allow：无 os 限制或 os 为目标系统时允许
 * disallow：仅当指定了 os 且不是目标系统时允许
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Rule {
    private RuleAction action;
    private OsRule os;

    public boolean allows(OsName target) {
        if (action == RuleAction.DISALLOW) {
            return os != null && !os.allows(target);
        }
        return os == null || os.allows(target);
    }
}
