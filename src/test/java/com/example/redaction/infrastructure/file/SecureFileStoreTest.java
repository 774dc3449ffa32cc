package com.example.redaction.infrastructure.file;

import com.example.redaction.infrastructure.config.RedactionProperties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assumptions.assumeThat;

class SecureFileStoreTest {

    @TempDir
    Path tempDir;

    private SecureFileStore store() {
        return new SecureFileStore(new RedactionProperties(DataSize.ofMegabytes(1), tempDir.resolve("work"),
                RedactionProperties.Layout.defaults(), RedactionProperties.Pdf.defaults()));
    }

    @Test
    void spoolsUploadsIntoAnOwnerOnlyDirectoryUnderTheWorkDirectory() throws Exception {
        SecureFileStore store = store();

        Path spooled = store.spool(new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8)), "../../etc/report 1.txt");

        assertThat(spooled.getFileName().toString()).isEqualTo("report_1.txt");
        assertThat(spooled.getParent().getParent()).isEqualTo(tempDir.resolve("work"));
        assertThat(Files.readString(spooled)).isEqualTo("hello");
        assumeThat(FileSystems.getDefault().supportedFileAttributeViews()).contains("posix");
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(spooled))).isEqualTo("rw-------");
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(spooled.getParent()))).isEqualTo("rwx------");
    }

    @Test
    void deleteSpooledRemovesFileAndDirectory() {
        SecureFileStore store = store();
        Path spooled = store.spool(new ByteArrayInputStream(new byte[]{1, 2, 3}), "a.pdf");

        store.deleteSpooled(spooled);

        assertThat(spooled).doesNotExist();
        assertThat(spooled.getParent()).doesNotExist();
    }

    @Test
    void tempFilesAreCreatedNextToTheTargetAndPublishedOntoIt() throws Exception {
        SecureFileStore store = store();
        Path target = tempDir.resolve("out").resolve("redacted.txt");
        Files.createDirectories(target.getParent());
        Files.writeString(target, "stale");

        Path temp = store.createTempFileNextTo(target);
        store.write(temp, "fresh".getBytes(StandardCharsets.UTF_8));
        store.publish(temp, target);

        assertThat(temp.getParent()).isEqualTo(target.getParent().toAbsolutePath());
        assertThat(temp).doesNotExist();
        assertThat(Files.readString(target)).isEqualTo("fresh");
    }

    @Test
    void secureDeleteWipesAndUnlinksAndIgnoresMissingFiles() throws Exception {
        SecureFileStore store = store();
        Path file = Files.write(tempDir.resolve("secret.bin"), new byte[200_000]);

        store.secureDelete(file);
        store.secureDelete(file);
        store.secureDelete(null);

        assertThat(file).doesNotExist();
    }

    @Test
    void readReturnsWhatWasWritten() throws Exception {
        SecureFileStore store = store();
        Path file = Files.createFile(tempDir.resolve("data.bin"));

        store.write(file, new byte[]{9, 8, 7});

        assertThat(store.read(file)).containsExactly(9, 8, 7);
    }

    @Test
    void sanitizeKeepsOnlyASafeBaseName() {
        assertThat(SecureFileStore.sanitize(null)).isEqualTo("upload");
        assertThat(SecureFileStore.sanitize("  ")).isEqualTo("upload");
        assertThat(SecureFileStore.sanitize("..")).isEqualTo("upload");
        assertThat(SecureFileStore.sanitize("C:\\Users\\jane\\tax return.pdf")).isEqualTo("tax_return.pdf");
        assertThat(SecureFileStore.sanitize("notes-v2.txt")).isEqualTo("notes-v2.txt");
    }
}
