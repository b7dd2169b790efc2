package com.ecaree.mappingconverter;

import com.ecaree.mappingconverter.manifest.Library;
import com.ecaree.mappingconverter.manifest.LibraryArtifacts;
import com.ecaree.mappingconverter.manifest.ManifestClient;
import com.ecaree.mappingconverter.manifest.ManifestException;
import com.ecaree.mappingconverter.manifest.OsName;
import com.ecaree.mappingconverter.manifest.ReleaseKind;
import com.ecaree.mappingconverter.manifest.RootManifest;
import com.ecaree.mappingconverter.manifest.VersionManifest;
import com.ecaree.mappingconverter.manifest.VersionRelease;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ManifestClientTest {
    @TempDir
    Path tempDir;

    private ManifestFixtures fixtures;
    private ManifestClient client;

    @BeforeEach
    public void setUp() throws IOException {
        fixtures = new ManifestFixtures(tempDir);
        client = new ManifestClient(fixtures.write(), 1000, 1000);
    }

    @Test
    public void testFetchRootManifest() throws IOException {
        RootManifest manifest = client.fetchRootManifest();

        assertEquals("1.20.1", manifest.getLatest().getRelease());
        assertEquals("23w31a", manifest.getLatest().getSnapshot());
        assertEquals(3, manifest.getVersions().size());

        VersionRelease release = manifest.findVersion("1.20.1").orElseThrow();
        assertEquals(ReleaseKind.RELEASE, release.getKind());
        assertEquals(OffsetDateTime.of(2023, 6, 12, 13, 25, 51, 0, ZoneOffset.UTC), release.getReleaseTime());
        assertEquals(1, release.getComplianceLevel());
        assertEquals("v1", release.getSha1());

        assertEquals(ReleaseKind.OLD_BETA, manifest.findVersion("b1.7.3").orElseThrow().getKind());
        assertEquals(1, manifest.versionsOfKind(ReleaseKind.SNAPSHOT).size());
        assertEquals(release, manifest.latestRelease().orElseThrow());
        assertFalse(manifest.findVersion("0.0.0").isPresent());
    }

    @Test
    public void testFetchVersionManifest() throws IOException {
        VersionRelease release = client.fetchRootManifest().findVersion("1.20.1").orElseThrow();
        VersionManifest version = client.fetchVersionManifest(release);

        assertEquals("1.20.1", version.getId());
        assertEquals("c2", version.getDownloads().getClientMappings().getSha1());
        assertEquals(ManifestFixtures.SERVER_MAPPINGS.length(), version.getDownloads().getServerMappings().getSize());
        assertEquals(2, version.getLibraries().size());

        Library lwjgl = version.getLibraries().get(0);
        assertEquals("org.lwjgl:lwjgl:3.3.1", lwjgl.getName());
        assertEquals("natives-linux", lwjgl.getNatives().get(OsName.LINUX));
        assertFalse(lwjgl.getExtract().isEmpty());
        assertTrue(lwjgl.getRules().isEmpty(), "Missing rules should default to empty");

        Library bridge = version.getLibraries().get(1);
        assertTrue(bridge.getNatives().isEmpty(), "Missing natives should default to empty");
        assertTrue(bridge.getExtract().isEmpty());
        assertEquals(OsName.OSX, bridge.getRules().get(0).getOs().getName());
    }

    @Test
    public void testDownloadMappings() throws IOException {
        VersionRelease release = client.fetchRootManifest().findVersion("1.20.1").orElseThrow();
        VersionManifest version = client.fetchVersionManifest(release);

        String mappings = client.downloadString(version.getDownloads().getMappings("client"));
        assertEquals(ManifestFixtures.CLIENT_MAPPINGS, mappings);

        byte[] bytes = client.download(version.getDownloads().getServerMappings());
        assertArrayEquals(ManifestFixtures.SERVER_MAPPINGS.getBytes(StandardCharsets.UTF_8), bytes);

        try (InputStream is = client.openStream(version.getDownloads().getServerMappings())) {
            assertEquals(ManifestFixtures.SERVER_MAPPINGS, new String(is.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    public void testDownloadLibraryWithNatives() throws IOException {
        VersionManifest version = client.fetchVersionManifest(new URL(fixtures.url("1.20.1.json")));
        Library lwjgl = version.getLibraries().get(0);

        Optional<LibraryArtifacts> linux = client.downloadLibrary(lwjgl, OsName.LINUX);
        assertTrue(linux.isPresent(), "Library without rules should be allowed");
        assertEquals("org/lwjgl/lwjgl/3.3.1/lwjgl-3.3.1.jar", linux.get().getArtifactPath());
        assertEquals("lwjgl", new String(linux.get().getArtifactBytes(), StandardCharsets.UTF_8));
        assertTrue(linux.get().hasNative());
        assertEquals("natives-linux", new String(linux.get().getNativeBytes(), StandardCharsets.UTF_8));

        Optional<LibraryArtifacts> osx = client.downloadLibrary(lwjgl, OsName.OSX);
        assertTrue(osx.isPresent());
        assertFalse(osx.get().hasNative(), "No natives are declared for osx");
    }

    @Test
    public void testLibraryRulesFollowRequestedOs() throws IOException {
        VersionManifest version = client.fetchVersionManifest(new URL(fixtures.url("1.20.1.json")));
        Library bridge = version.getLibraries().get(1);

        Optional<LibraryArtifacts> osx = client.downloadLibrary(bridge, OsName.OSX);
        assertTrue(osx.isPresent(), "osx-only library should download for osx on any host");
        assertEquals("ca/weblite/java-objc-bridge/1.1/java-objc-bridge-1.1.jar", osx.get().getArtifactPath());

        assertFalse(client.downloadLibrary(bridge, OsName.LINUX).isPresent());
        assertFalse(client.downloadLibrary(bridge, OsName.WINDOWS).isPresent());
        assertEquals(OsName.current() == OsName.OSX, client.downloadLibrary(bridge).isPresent());
    }

    @Test
    public void testMissingResource() {
        ManifestException e = assertThrows(ManifestException.class,
                () -> client.fetchRootManifest(fixtures.url("missing.json")));
        assertNotNull(e.getCause(), "Network failure should keep its cause");
    }

    @Test
    public void testInvalidJson() throws IOException {
        Files.writeString(tempDir.resolve("broken.json"), "{\"versions\": [ {\"id\": ");
        assertThrows(ManifestException.class, () -> client.fetchRootManifest(fixtures.url("broken.json")));

        Files.writeString(tempDir.resolve("bad-time.json"), """
                {"versions": [{"id": "1", "time": "yesterday"}]}
                """);
        assertThrows(ManifestException.class, () -> client.fetchRootManifest(fixtures.url("bad-time.json")));
    }

    @Test
    public void testEmptyResponse() throws IOException {
        Files.writeString(tempDir.resolve("empty.json"), "");
        assertThrows(ManifestException.class, () -> client.fetchRootManifest(fixtures.url("empty.json")));
    }

    @Test
    public void testInvalidUrl() {
        assertThrows(ManifestException.class, () -> client.fetchRootManifest("not a url"));
    }

    @Test
    @EnabledIfEnvironmentVariable(named = "TEST_NETWORK", matches = "true")
    public void testMojangManifest() throws IOException {
        RootManifest manifest = new ManifestClient().fetchRootManifest();

        assertNotNull(manifest.getLatest().getRelease());
        assertTrue(manifest.latestRelease().isPresent(), "Latest release should be listed");
    }
}
