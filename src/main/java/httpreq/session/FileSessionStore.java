package httpreq.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.vavr.control.Option;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;
import java.util.Set;

/**
 * Sessions as {@code session_<host>.json} files under a base directory. The directory is created owner-only
 * (0700) and files are written owner-only (0600); a file readable by group or others is refused on load.
 */
@Slf4j
public class FileSessionStore implements SessionStore {
    private static final Set<PosixFilePermission> DIRECTORY_PERMISSIONS = PosixFilePermissions.fromString("rwx------");
    private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");
    private static final Set<PosixFilePermission> READABLE_BY_OTHERS =
        EnumSet.of(PosixFilePermission.GROUP_READ, PosixFilePermission.OTHERS_READ);

    private final Path baseDir;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public FileSessionStore(final Path baseDir) {
        this.baseDir = baseDir;
    }

    public Path path(final String host) {
        return baseDir.resolve("session_" + host.replace(':', '_').replace('/', '_') + ".json");
    }

    @Override
    public Option<Session> load(final String host) throws SessionError {
        final var path = path(host);
        if (!Files.exists(path)) {
            return Option.none();
        }
        try {
            if (isPosix()) {
                final var permissions = Files.getPosixFilePermissions(path);
                if (permissions.stream().anyMatch(READABLE_BY_OTHERS::contains)) {
                    throw new SessionError(String.format(
                        "session file %s has insecure permissions (%s): group or world readable, refusing to load",
                        path,
                        PosixFilePermissions.toString(permissions)));
                }
            }
            return Option.of(mapper.readValue(path.toFile(), Session.class));
        } catch (final IOException e) {
            throw new SessionError("failed to read session " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(final Session session) throws SessionError {
        final var path = path(session.getHost());
        try {
            ensureBaseDir();
            final var bytes = mapper.writeValueAsBytes(session);
            if (isPosix() && !Files.exists(path)) {
                Files.createFile(path, PosixFilePermissions.asFileAttribute(FILE_PERMISSIONS));
            }
            Files.write(path, bytes);
            if (isPosix()) {
                Files.setPosixFilePermissions(path, FILE_PERMISSIONS);
            }
            log.debug("Saved session for {} to {}", session.getHost(), path);
        } catch (final IOException e) {
            throw new SessionError("failed to write session " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(final String host) throws SessionError {
        final var path = path(host);
        try {
            Files.deleteIfExists(path);
        } catch (final IOException e) {
            throw new SessionError("failed to delete session " + path + ": " + e.getMessage(), e);
        }
    }

    private void ensureBaseDir() throws IOException {
        if (Files.isDirectory(baseDir)) {
            return;
        }
        if (isPosix()) {
            Files.createDirectories(baseDir, PosixFilePermissions.asFileAttribute(DIRECTORY_PERMISSIONS));
        } else {
            Files.createDirectories(baseDir);
        }
    }

    private static boolean isPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
}
