package org.ftpbrowse.controllers.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.nifi.logging.ComponentLog;
import org.ftpbrowse.controllers.ftp.exception.FTPErrorType;
import org.ftpbrowse.controllers.ftp.exception.FTPFileOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FTPSession and its child sessions
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FTP Session Tests")
public class FTPSessionTest {

    @Mock
    private ComponentLog mockLogger;

    @Mock
    private FTPClient mockClient;

    @Mock
    private FTPClient mockChildClient;

    private FTPSession session;

    @BeforeEach
    void setUp() {
        FTPConnectionIdentity identity = new FTPConnectionIdentity(FTPScheme.FTP, "host.example.com", 21,
                "user", "pw", "/");
        session = new FTPSession(identity, mockClient, id -> mockChildClient, mockLogger);
    }

    private static FTPFile entry(String name, int type) {
        FTPFile file = new FTPFile();
        file.setName(name);
        file.setType(type);
        return file;
    }

    private void stubListing(String directory, FTPFile... files) throws IOException {
        when(mockClient.listFiles(directory)).thenReturn(files);
        when(mockClient.getReplyCode()).thenReturn(226);
    }

    @Test
    @DisplayName("Should list a directory without dot entries and fill the stat cache")
    void testListFiles() throws Exception {
        stubListing("/pub", entry(".", FTPFile.DIRECTORY_TYPE), entry("..", FTPFile.DIRECTORY_TYPE),
                entry("readme.txt", FTPFile.FILE_TYPE), entry("releases", FTPFile.DIRECTORY_TYPE));

        List<FTPFile> files = session.listFiles("/pub/");

        assertEquals(2, files.size());
        assertEquals(2, session.getStatCache().size());
        assertTrue(session.isDirectory("/pub/releases"));
        assertTrue(session.exists("/pub/readme.txt"));
        assertFalse(session.isDirectory("/pub/readme.txt"));
        verify(mockClient, times(1)).listFiles(anyString());
    }

    @Test
    @DisplayName("Should list the parent directory once on a stat cache miss")
    void testStatListsParent() throws Exception {
        stubListing("/pub", entry("readme.txt", FTPFile.FILE_TYPE));

        assertNotNull(session.stat("/pub/readme.txt"));
        assertNull(session.stat("/pub/missing.txt"));
        assertNotNull(session.stat("pub/readme.txt"));
        verify(mockClient, times(2)).listFiles("/pub");
    }

    @Test
    @DisplayName("Should report the root as a directory without a round trip")
    void testStatRoot() throws Exception {
        assertTrue(session.isDirectory("/"));
        assertTrue(session.isDirectory(""));
        verifyNoInteractions(mockClient);
    }

    @Test
    @DisplayName("Should raise a file operation error when a listing is refused")
    void testListRefused() throws Exception {
        when(mockClient.listFiles("/missing")).thenReturn(new FTPFile[0]);
        when(mockClient.getReplyCode()).thenReturn(550);
        when(mockClient.getReplyString()).thenReturn("550 No such directory");

        FTPFileOperationException e = assertThrows(FTPFileOperationException.class, () -> session.listFiles("/missing"));
        assertEquals(FTPErrorType.FILE_NOT_FOUND, e.getErrorType());
        assertEquals(550, e.getFtpReplyCode());
        assertEquals(FTPFileOperationException.FileOperation.LIST, e.getOperation());
    }

    @Test
    @DisplayName("Should report entries under a missing directory as absent")
    void testStatUnderMissingDirectory() throws Exception {
        when(mockClient.listFiles("/missing")).thenReturn(new FTPFile[0]);
        when(mockClient.getReplyCode()).thenReturn(550);
        when(mockClient.getReplyString()).thenReturn("550 No such directory");

        assertFalse(session.exists("/missing/file.txt"));
        assertFalse(session.isDirectory("/missing/sub"));
        assertNull(session.stat("/missing/file.txt"));
    }

    @Test
    @DisplayName("Should still fail a stat when the parent listing is refused temporarily")
    void testStatTransientListFailure() throws Exception {
        when(mockClient.listFiles("/busy")).thenReturn(new FTPFile[0]);
        when(mockClient.getReplyCode()).thenReturn(450);
        when(mockClient.getReplyString()).thenReturn("450 Directory busy");

        FTPFileOperationException e = assertThrows(FTPFileOperationException.class, () -> session.exists("/busy/file.txt"));
        assertEquals(450, e.getFtpReplyCode());
    }

    @Test
    @DisplayName("Should invalidate cached entries after mutations")
    void testMutationsInvalidateCache() throws Exception {
        stubListing("/", entry("old", FTPFile.FILE_TYPE), entry("dir", FTPFile.DIRECTORY_TYPE));
        session.listFiles("/");
        when(mockClient.rename("/old", "/new")).thenReturn(true);
        when(mockClient.removeDirectory("/dir")).thenReturn(true);

        session.rename("/old", "/new");
        session.removeDirectory("/dir/");

        assertEquals(0, session.getStatCache().size());
    }

    @Test
    @DisplayName("Should raise an error when the server refuses a mutation")
    void testMutationRefused() throws Exception {
        when(mockClient.deleteFile("/locked")).thenReturn(false);
        when(mockClient.getReplyCode()).thenReturn(550);
        when(mockClient.getReplyString()).thenReturn("550 Permission denied");

        FTPFileOperationException e = assertThrows(FTPFileOperationException.class, () -> session.remove("/locked"));
        assertEquals(FTPErrorType.OPERATION_REFUSED, e.getErrorType());
        assertEquals(FTPFileOperationException.FileOperation.DELETE, e.getOperation());
        assertFalse(e.isRecoverable());
    }

    @Test
    @DisplayName("Should read a file on a child connection")
    void testOpenForRead() throws Exception {
        when(mockChildClient.retrieveFileStream("/file.txt"))
                .thenReturn(new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8)));
        when(mockChildClient.completePendingCommand()).thenReturn(true);

        String content;
        try (InputStream in = session.openForRead("/file.txt")) {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            assertFalse(session.getChildren().get(0).isTransferFinished());
        }

        assertEquals("hello", content);
        FTPChildSession child = session.getChildren().get(0);
        assertTrue(child.isTransferFinished());
        assertEquals(FTPChildSession.Direction.READ, child.getDirection());
        assertFalse(child.isClosed());
        verify(mockClient, never()).retrieveFileStream(anyString());
    }

    @Test
    @DisplayName("Should write a file on a child connection and forget its cached metadata")
    void testOpenForWrite() throws Exception {
        stubListing("/", entry("out.txt", FTPFile.FILE_TYPE));
        session.listFiles("/");
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        when(mockChildClient.storeFileStream("/out.txt")).thenReturn(sink);
        when(mockChildClient.completePendingCommand()).thenReturn(true);

        try (OutputStream out = session.openForWrite("/out.txt")) {
            out.write("data".getBytes(StandardCharsets.UTF_8));
        }

        assertEquals("data", sink.toString(StandardCharsets.UTF_8.name()));
        assertNull(session.getStatCache().get("/out.txt"));
        assertTrue(session.getChildren().get(0).isTransferFinished());
    }

    @Test
    @DisplayName("Should close the child connection when a file cannot be opened")
    void testOpenForReadMissingFile() throws Exception {
        when(mockChildClient.retrieveFileStream("/missing")).thenReturn(null);
        when(mockChildClient.getReplyCode()).thenReturn(550);
        when(mockChildClient.isConnected()).thenReturn(true);

        assertThrows(FTPFileOperationException.class, () -> session.openForRead("/missing"));
        assertTrue(session.getChildren().isEmpty());
        verify(mockChildClient).disconnect();
    }

    @Test
    @DisplayName("Should report a failed transfer completion when the stream is closed")
    void testTransferCompletionFailure() throws Exception {
        when(mockChildClient.retrieveFileStream("/file.txt")).thenReturn(new ByteArrayInputStream(new byte[0]));
        when(mockChildClient.completePendingCommand()).thenReturn(false);

        InputStream in = session.openForRead("/file.txt");

        FTPFileOperationException e = assertThrows(FTPFileOperationException.class, in::close);
        assertEquals(FTPErrorType.TRANSFER_ERROR, e.getErrorType());
        assertTrue(session.getChildren().get(0).isTransferFinished());
    }

    @Test
    @DisplayName("Should only reap children whose transfer finished")
    void testReapFinishedChildren() throws Exception {
        FTPClient runningClient = mock(FTPClient.class);
        FTPClient[] clients = { mockChildClient, runningClient };
        int[] next = { 0 };
        session = new FTPSession(session.getIdentity(), mockClient, id -> clients[next[0]++], mockLogger);
        when(mockChildClient.retrieveFileStream("/a")).thenReturn(new ByteArrayInputStream(new byte[0]));
        when(mockChildClient.completePendingCommand()).thenReturn(true);
        when(runningClient.retrieveFileStream("/b")).thenReturn(new ByteArrayInputStream(new byte[0]));

        session.openForRead("/a").close();
        session.openForRead("/b");

        assertEquals(1, session.reapFinishedChildren());
        assertEquals(1, session.getChildren().size());
        assertEquals("/b", session.getChildren().get(0).getRemotePath());
        assertEquals(0, session.reapFinishedChildren());
    }

    @Test
    @DisplayName("Should close children and the control connection exactly once")
    void testClose() throws Exception {
        when(mockChildClient.retrieveFileStream("/a")).thenReturn(new ByteArrayInputStream(new byte[0]));
        when(mockChildClient.isConnected()).thenReturn(true);
        when(mockClient.isConnected()).thenReturn(true);
        session.openForRead("/a");

        session.close();
        session.close();

        assertTrue(session.isClosed());
        assertTrue(session.getChildren().isEmpty());
        verify(mockChildClient, times(1)).disconnect();
        verify(mockClient, times(1)).logout();
        verify(mockClient, times(1)).disconnect();
        assertThrows(IllegalStateException.class, () -> session.openForRead("/a"));
    }

    @Test
    @DisplayName("Should treat a lost control socket as closed")
    void testLostControlConnection() {
        when(mockClient.isConnected()).thenReturn(false);

        assertTrue(session.isClosed());
    }

    @Test
    @DisplayName("Should normalize remote paths")
    void testPathHelpers() {
        assertEquals("/", FTPSession.normalize(null));
        assertEquals("/", FTPSession.normalize("///"));
        assertEquals("/a/b", FTPSession.normalize("a/b/"));
        assertEquals("/", FTPSession.parent("/a"));
        assertEquals("/a", FTPSession.parent("/a/b"));
        assertEquals("/a", FTPSession.join("/", "a"));
        assertEquals("/a/b", FTPSession.join("/a", "b"));
    }
}
