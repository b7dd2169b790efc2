package com.ecaree.mappingconverter.manifest;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OsRule {
    private OsName name;

    public boolean allows(OsName os) {
        return name != null && name == os;
    }
}
