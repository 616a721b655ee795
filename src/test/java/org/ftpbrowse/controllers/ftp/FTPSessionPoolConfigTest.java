package org.ftpbrowse.controllers.ftp;

import org.apache.nifi.components.PropertyDescriptor;
import org.apache.nifi.components.PropertyValue;
import org.apache.nifi.controller.ConfigurationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("FTP Session Pool Config Tests")
public class FTPSessionPoolConfigTest {

    @Test
    @DisplayName("Should default to the pool's standard limits")
    void testDefaults() {
        FTPSessionPoolConfig config = FTPSessionPoolConfig.builder().build();

        assertEquals(3, config.getCapacity());
        assertEquals(120000, config.getIdleTimeoutMillis());
        assertEquals(5000, config.getHealthCheckIntervalMillis());
        assertEquals(20000, config.getStatCacheSize());
        assertEquals(30000, config.getConnectionTimeoutMillis());
        assertEquals(60000, config.getDataTimeoutMillis());
        assertEquals("UTF-8", config.getControlEncoding());
        assertFalse(config.isActiveMode());
        assertTrue(config.isValidateServerCertificate());
    }

    @Test
    @DisplayName("Should reject out of range values")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> FTPSessionPoolConfig.builder().capacity(0).build());
        assertThrows(IllegalArgumentException.class, () -> FTPSessionPoolConfig.builder().idleTimeoutMillis(-1).build());
        assertThrows(IllegalArgumentException.class, () -> FTPSessionPoolConfig.builder().statCacheSize(0).build());
        assertEquals("UTF-8", FTPSessionPoolConfig.builder().controlEncoding("").build().getControlEncoding());
    }

    private static PropertyValue value(String raw, Long millis) {
        PropertyValue value = mock(PropertyValue.class);
        when(value.evaluateAttributeExpressions()).thenReturn(value);
        when(value.getValue()).thenReturn(raw);
        when(value.asInteger()).thenAnswer(invocation -> Integer.valueOf(raw));
        when(value.asBoolean()).thenAnswer(invocation -> Boolean.valueOf(raw));
        when(value.asTimePeriod(TimeUnit.MILLISECONDS)).thenReturn(millis);
        return value;
    }

    private static void stub(ConfigurationContext context, PropertyDescriptor descriptor, String raw, Long millis) {
        PropertyValue value = value(raw, millis);
        when(context.getProperty(descriptor)).thenReturn(value);
    }

    @Test
    @DisplayName("Should read every setting from the configuration context")
    void testFromContext() {
        ConfigurationContext context = mock(ConfigurationContext.class);
        stub(context, PersistentFTPSessionPoolService.POOL_CAPACITY, "5", null);
        stub(context, PersistentFTPSessionPoolService.CONNECTION_IDLE_TIMEOUT, "10 min", 600000L);
        stub(context, PersistentFTPSessionPoolService.HEALTH_CHECK_INTERVAL, "10 sec", 10000L);
        stub(context, PersistentFTPSessionPoolService.STAT_CACHE_SIZE, "100", null);
        stub(context, PersistentFTPSessionPoolService.CONNECTION_TIMEOUT, "5 sec", 5000L);
        stub(context, PersistentFTPSessionPoolService.DATA_TIMEOUT, "15 sec", 15000L);
        stub(context, PersistentFTPSessionPoolService.CONTROL_ENCODING, "ISO-8859-1", null);
        stub(context, PersistentFTPSessionPoolService.ACTIVE_MODE, "true", null);
        stub(context, PersistentFTPSessionPoolService.VALIDATE_SERVER_CERTIFICATE, "false", null);

        FTPSessionPoolConfig config = FTPSessionPoolConfig.fromContext(context);

        assertEquals(5, config.getCapacity());
        assertEquals(600000, config.getIdleTimeoutMillis());
        assertEquals(10000, config.getHealthCheckIntervalMillis());
        assertEquals(100, config.getStatCacheSize());
        assertEquals(5000, config.getConnectionTimeoutMillis());
        assertEquals(15000, config.getDataTimeoutMillis());
        assertEquals("ISO-8859-1", config.getControlEncoding());
        assertTrue(config.isActiveMode());
        assertFalse(config.isValidateServerCertificate());
        assertFalse(config.toString().isEmpty());
    }
}
