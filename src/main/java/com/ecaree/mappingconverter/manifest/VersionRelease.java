package com.ecaree.mappingconverter.manifest;

import com.google.gson.annotations.SerializedName;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.net.URL;
import java.time.OffsetDateTime;

/**
 * 版本列表中的一项，url 指向该版本的 {@link VersionManifest}
 */
@Data
@NoArgsConstructor
public class VersionRelease {
    private String id;

    @SerializedName("type")
    private ReleaseKind kind;

    private URL url;
    private OffsetDateTime time;
    private OffsetDateTime releaseTime;
    private String sha1;
    private int complianceLevel;
}
