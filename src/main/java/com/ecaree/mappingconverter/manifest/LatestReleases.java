package com.ecaree.mappingconverter.manifest;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class LatestReleases {
    private String release;
    private String snapshot;
}
