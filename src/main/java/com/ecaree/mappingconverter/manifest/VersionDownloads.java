package com.ecaree.mappingconverter.manifest;

import com.google.gson.annotations.SerializedName;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class VersionDownloads {
    private DownloadInfo client;

    @SerializedName("client_mappings")
    private DownloadInfo clientMappings;

    private DownloadInfo server;

    @SerializedName("server_mappings")
    private DownloadInfo serverMappings;

    /**
     * @param side client 或 server
     */
    public DownloadInfo getMappings(String side) {
        return switch (side) {
            case "client" -> clientMappings;
            case "server" -> serverMappings;
            default -> throw new IllegalArgumentException("Side must be 'client' or 'server', got: " + side);
        };
    }
}
