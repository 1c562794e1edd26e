package com.filesmanager.error;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class FileErrorKindTest {

    @Test
    void testClassify() {
        assertEquals(FileErrorKind.PERMISSION, FileErrorKind.classify(new AccessDeniedException("/a")));
        assertEquals(FileErrorKind.NOT_FOUND, FileErrorKind.classify(new NoSuchFileException("/b")));
        assertEquals(FileErrorKind.IO, FileErrorKind.classify(new IOException("disk full")));
    }

    @Test
    void testFileErrorCarriesKindAndMessage() {
        Path path = Path.of("photos", "trip.jpg");
        FileError error = FileError.of(path, new NoSuchFileException(path.toString()));

        assertEquals(path, error.path());
        assertEquals(FileErrorKind.NOT_FOUND, error.kind());
        assertEquals(path.toString(), error.message());
    }
}
