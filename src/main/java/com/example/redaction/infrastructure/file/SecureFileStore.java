package com.example.redaction.infrastructure.file;

import com.example.redaction.infrastructure.config.RedactionProperties;
import com.example.redaction.infrastructure.exception.FileStoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Owner-only temp files for uploads and unverified output, atomic publication of verified output and
 * secure deletion (overwrite with zeros, flush, unlink) of everything that must not survive.
 */
@Component
public class SecureFileStore {

    private static final Logger log = LoggerFactory.getLogger(SecureFileStore.class);
    private static final boolean POSIX = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    private static final Set<PosixFilePermission> OWNER_FILE = PosixFilePermissions.fromString("rw-------");
    private static final Set<PosixFilePermission> OWNER_DIRECTORY = PosixFilePermissions.fromString("rwx------");
    private static final int WIPE_CHUNK = 64 * 1024;

    private final Path workDirectory;

    public SecureFileStore(RedactionProperties properties) {
        this.workDirectory = properties.workDirectory();
    }

    /**
     * Creates an empty owner-only file in the directory of {@code target}, so it can later be moved onto
     * the target atomically.
     *
     * @param target final output location
     * @return path of the new temp file
     */
    public Path createTempFileNextTo(Path target) {
        Path directory = target.toAbsolutePath().getParent();
        try {
            Files.createDirectories(directory);
            String name = target.getFileName().toString();
            return POSIX
                    ? Files.createTempFile(directory, ".redact-", "-" + name, attribute(OWNER_FILE))
                    : ownerOnly(Files.createTempFile(directory, ".redact-", "-" + name));
        } catch (IOException e) {
            throw new FileStoreException("Unable to create a temp file next to " + target, e);
        }
    }

    /**
     * Copies an upload into a fresh owner-only directory under the work directory, keeping its (sanitized)
     * original name so content sniffing and reports see it.
     *
     * @param content  upload stream; not closed
     * @param fileName client supplied file name, may be {@code null}
     * @return path of the spooled file; remove it with {@link #deleteSpooled(Path)}
     */
    public Path spool(InputStream content, String fileName) {
        Path directory = null;
        try {
            directory = createTempDirectory();
            Path file = directory.resolve(sanitize(fileName));
            if (POSIX) {
                Files.createFile(file, attribute(OWNER_FILE));
            } else {
                ownerOnly(Files.createFile(file));
            }
            try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.TRUNCATE_EXISTING)) {
                content.transferTo(out);
            }
            return file;
        } catch (IOException e) {
            if (directory != null) {
                deleteQuietly(directory, e);
            }
            throw new FileStoreException("Unable to spool upload " + fileName, e);
        }
    }

    /**
     * Securely deletes a file created by {@link #spool(InputStream, String)} together with its directory.
     */
    public void deleteSpooled(Path file) {
        secureDelete(file);
        Path directory = file.getParent();
        try {
            if (directory != null) {
                Files.deleteIfExists(directory);
            }
        } catch (IOException e) {
            throw new FileStoreException("Unable to remove spool directory " + directory, e);
        }
    }

    /**
     * Creates an owner-only scratch directory under the work directory.
     */
    public Path createTempDirectory() {
        try {
            Path root = workDirectory;
            if (root != null) {
                Files.createDirectories(root);
            }
            if (POSIX) {
                return root == null
                        ? Files.createTempDirectory("redaction-", attribute(OWNER_DIRECTORY))
                        : Files.createTempDirectory(root, "redaction-", attribute(OWNER_DIRECTORY));
            }
            return ownerOnly(root == null ? Files.createTempDirectory("redaction-") : Files.createTempDirectory(root, "redaction-"));
        } catch (IOException e) {
            throw new FileStoreException("Unable to create a temp directory", e);
        }
    }

    public void write(Path file, byte[] content) {
        try {
            Files.write(file, content, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new FileStoreException("Unable to write " + file, e);
        }
    }

    public byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new FileStoreException("Unable to read " + file, e);
        }
    }

    /**
     * Moves a verified temp file onto its final location, replacing any existing file.
     */
    public void publish(Path temp, Path target) {
        try {
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move is not supported for {}; falling back to a plain move", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new FileStoreException("Unable to publish " + target, e);
        }
    }

    /**
     * Overwrites the file with zeros, forces the write to the device and unlinks it. Missing files are ignored.
     */
    public void secureDelete(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return;
        }
        try {
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
                long size = channel.size();
                ByteBuffer zeros = ByteBuffer.allocate((int) Math.min(WIPE_CHUNK, Math.max(size, 1)));
                long position = 0;
                while (position < size) {
                    zeros.clear();
                    zeros.limit((int) Math.min(zeros.capacity(), size - position));
                    position += channel.write(zeros, position);
                }
                channel.force(true);
            }
            Files.delete(file);
            log.debug("Securely deleted {}", file);
        } catch (IOException e) {
            throw new FileStoreException("Unable to securely delete " + file, e);
        }
    }

    private void deleteQuietly(Path directory, IOException failure) {
        try (Stream<Path> walk = Files.walk(directory)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                if (Files.isRegularFile(path)) {
                    secureDelete(path);
                } else {
                    Files.deleteIfExists(path);
                }
            }
        } catch (IOException | FileStoreException e) {
            failure.addSuppressed(e);
        }
    }

    static String sanitize(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "upload";
        }
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).replaceAll("[^A-Za-z0-9._-]", "_");
        if (name.isEmpty() || name.chars().allMatch(c -> c == '.')) {
            return "upload";
        }
        return name;
    }

    private static FileAttribute<Set<PosixFilePermission>> attribute(Set<PosixFilePermission> permissions) {
        return PosixFilePermissions.asFileAttribute(permissions);
    }

    private static Path ownerOnly(Path path) {
        File file = path.toFile();
        boolean restricted = file.setReadable(false, false) && file.setReadable(true, true)
                && file.setWritable(false, false) && file.setWritable(true, true);
        if (!restricted) {
            log.warn("Could not restrict permissions of {} to its owner", path);
        }
        return path;
    }
}
