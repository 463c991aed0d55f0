package io.replicheck.checkservice.infra.soa;

import static org.assertj.core.api.Assertions.assertThat;

import io.replicheck.replication.model.NamespaceId;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SoaNamespaceRegistryTest {

    @TempDir
    Path soaDir;

    @Test
    void listsSmartstackNamespacesAcrossServices() throws IOException {
        write("web", "main:\n  proxy_port: 20001\ncanary:\n  proxy_port: 20002\n");
        write("api", "main:\n  proxy_port: 20003\n");
        Files.createDirectories(soaDir.resolve("no-smartstack"));

        SoaNamespaceRegistry registry = new SoaNamespaceRegistry(new SoaConfigurationReader(soaDir));

        assertThat(registry.listNamespaces()).containsExactly(
            NamespaceId.of("api", "main"),
            NamespaceId.of("web", "canary"),
            NamespaceId.of("web", "main"));
    }

    @Test
    void skipsUnreadableFilesAndMalformedNamespaces() throws IOException {
        write("broken", "main: [unclosed\n");
        write("web", "main: {}\n\"bad.name\": {}\n");

        SoaNamespaceRegistry registry = new SoaNamespaceRegistry(new SoaConfigurationReader(soaDir));

        assertThat(registry.listNamespaces()).containsExactly(NamespaceId.of("web", "main"));
    }

    private void write(String service, String content) throws IOException {
        Path dir = Files.createDirectories(soaDir.resolve(service));
        Files.writeString(dir.resolve("smartstack.yaml"), content);
    }
}
