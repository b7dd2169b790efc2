package com.ecaree.mappingconverter.manifest;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * version_manifest_v2.json
 */
@Data
@NoArgsConstructor
public class RootManifest {
    private LatestReleases latest;
    private List<VersionRelease> versions = new ArrayList<>();

    public Optional<VersionRelease> findVersion(String id) {
        return versions.stream()
                .filter(v -> id.equals(v.getId()))
                .findFirst();
    }

    public Optional<VersionRelease> latestRelease() {
        if (latest == null || latest.getRelease() == null) {
            return Optional.empty();
        }
        return findVersion(latest.getRelease());
    }

    public List<VersionRelease> versionsOfKind(ReleaseKind kind) {
        return versions.stream()
                .filter(v -> v.getKind() == kind)
                .collect(Collectors.toList());
    }
}
