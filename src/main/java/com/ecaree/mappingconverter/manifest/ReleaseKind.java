package com.ecaree.mappingconverter.manifest;

import com.google.gson.annotations.SerializedName;

public enum ReleaseKind {
    @SerializedName("snapshot")
    SNAPSHOT,
    @SerializedName("release")
    RELEASE,
    @SerializedName("old_beta")
    OLD_BETA,
    @SerializedName("old_alpha")
    OLD_ALPHA
}
