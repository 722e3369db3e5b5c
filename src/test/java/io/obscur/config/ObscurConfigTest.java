package io.obscur.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

final class ObscurConfigTest {

    @Test
    void identityNamesAreMadePathSafe() {
        Assertions.assertEquals("default", ObscurConfig.sanitizeIdentity(null));
        Assertions.assertEquals("default", ObscurConfig.sanitizeIdentity("   "));
        Assertions.assertEquals("default", ObscurConfig.sanitizeIdentity("!!"));
        Assertions.assertEquals("alice-smith", ObscurConfig.sanitizeIdentity(" Alice Smith "));
        Assertions.assertEquals("a-b", ObscurConfig.sanitizeIdentity("a//b"));
        Assertions.assertEquals("id..-etc", ObscurConfig.sanitizeIdentity("../etc"));
        Assertions.assertEquals("ab".repeat(32), ObscurConfig.sanitizeIdentity("AB".repeat(32)));
    }

    @Test
    void defaultIdentityLivesAtTheRoot() {
        Path base = Paths.get("build-root").toAbsolutePath().normalize();
        ObscurConfig config = ObscurConfig.fromRoot("build-root");

        Assertions.assertEquals("default", config.identity());
        Assertions.assertEquals(base, config.rootDir());
        Assertions.assertEquals(base, config.rootBaseDir());
        Assertions.assertEquals(base.resolve("obscur.db"), config.dbFile());
        Assertions.assertEquals(base.resolve("audit").resolve("audit.log"), config.auditFile());
        Assertions.assertEquals(base.resolve(ObscurConfig.SETTINGS_FILE_NAME), config.settingsFile());
    }

    @Test
    void otherIdentitiesGetTheirOwnDirectory() {
        Path base = Paths.get("build-root").toAbsolutePath().normalize();
        ObscurConfig config = ObscurConfig.fromRoot("build-root", "Bob");

        Assertions.assertEquals("bob", config.identity());
        Assertions.assertEquals(base.resolve("identities").resolve("bob"), config.rootDir());
        Assertions.assertEquals(base, config.rootBaseDir());
        Assertions.assertEquals(base.resolve("identities").resolve("bob").resolve("obscur.db"), config.dbFile());
        Assertions.assertEquals(Paths.get("data").toAbsolutePath().normalize(), ObscurConfig.fromRoot(null).rootDir());
    }
}
