package io.obscur.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ObscurConfig {
    public static final String DEFAULT_IDENTITY = "default";
    public static final String DEFAULT_IDENTITIES_DIR = "identities";
    public static final String SETTINGS_FILE_NAME = "obscur-settings.json";

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String identity;

    public ObscurConfig(Path rootDir, Path rootBaseDir, String identity) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.identity = identity;
    }

    public static ObscurConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_IDENTITY);
    }

    /**
     * Each identity (usually its public key) gets its own directory so message
     * logs, queues and audit chains never mix between accounts.
     */
    public static ObscurConfig fromRoot(String root, String identity) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeIdentity = sanitizeIdentity(identity);
        Path scoped = DEFAULT_IDENTITY.equals(safeIdentity)
                ? base
                : base.resolve(DEFAULT_IDENTITIES_DIR).resolve(safeIdentity);
        return new ObscurConfig(scoped, base, safeIdentity);
    }

    static String sanitizeIdentity(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_IDENTITY : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.isBlank() || "-".equals(value)) {
            return DEFAULT_IDENTITY;
        }
        if (value.startsWith(".")) {
            value = "id" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String identity() {
        return identity;
    }

    public Path dbFile() {
        return rootDir.resolve("obscur.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
