package com.modflow.mf6io.io.testing;

import com.modflow.mf6io.spec.ComponentSpec;
import com.modflow.mf6io.spec.SpecLoader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class TestResources {

    private TestResources() {}

    private static final Path CLASSPATH_CACHE_DIR = initClasspathCacheDir();

    /** Loads {@code /dfn/<name>.dfn} from the test classpath. */
    public static ComponentSpec spec(String name) throws Exception {
        String resourceName = "dfn/" + name + ".dfn";
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("Missing classpath resource: " + resourceName);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return new SpecLoader().load(name, reader);
            }
        }
    }

    /** Copies a classpath resource into a temporary directory and returns its path there. */
    public static Path extractClasspathResource(String resourceName) throws IOException {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(normalized)) {
            if (in == null) {
                throw new IOException("Missing classpath resource: " + normalized);
            }
            Path target = CLASSPATH_CACHE_DIR.resolve(normalized).normalize();
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            target.toFile().deleteOnExit();
            return target;
        }
    }

    private static Path initClasspathCacheDir() {
        try {
            Path dir = Files.createTempDirectory("mf6io_test_resources");
            dir.toFile().deleteOnExit();
            return dir;
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create classpath cache directory", ex);
        }
    }
}
