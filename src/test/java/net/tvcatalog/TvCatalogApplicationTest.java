package net.tvcatalog;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TvCatalogApplicationTest {

    private static final String KEY = "TV_CATALOG_TEST_DOTENV_KEY";

    @AfterEach
    void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    void loadsDotEnvEntriesIntoSystemProperties(@TempDir Path dir) throws IOException {
        Path env = dir.resolve(".env");
        Files.writeString(env, KEY + "=from-file\n");

        TvCatalogApplication.loadDotEnvFile(env);

        assertThat(System.getProperty(KEY)).isEqualTo("from-file");
    }

    @Test
    void keepsExistingSystemProperties(@TempDir Path dir) throws IOException {
        Path env = dir.resolve(".env");
        Files.writeString(env, KEY + "=from-file\n");
        System.setProperty(KEY, "preset");

        TvCatalogApplication.loadDotEnvFile(env);

        assertThat(System.getProperty(KEY)).isEqualTo("preset");
    }

    @Test
    void ignoresMissingFile(@TempDir Path dir) {
        TvCatalogApplication.loadDotEnvFile(dir.resolve(".env"));

        assertThat(System.getProperty(KEY)).isNull();
    }
}
