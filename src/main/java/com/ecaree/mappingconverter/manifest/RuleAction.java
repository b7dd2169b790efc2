package com.ecaree.mappingconverter.manifest;

import com.google.gson.annotations.SerializedName;

public enum RuleAction {
    @SerializedName("allow")
    ALLOW,
    @SerializedName("disallow")
    DISALLOW
}
