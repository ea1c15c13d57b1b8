package group.cloudtrailsource.config;

import group.cloudtrailsource.SourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceConfigTest {

    private static final Map<String, String> NO_ENV = Map.of();

    @Test
    void testDefaults() {
        SourceConfig config = SourceConfig.fromMap(Map.of(), NO_ENV::get);

        assertEquals(32, config.getDownloadConcurrency());
        assertEquals("", config.getInterval());
        assertEquals("", config.getAccountList());
        assertFalse(config.isUseS3Sns());
        assertTrue(config.isSqsDelete());
        assertEquals("", config.getSqsOwnerAccount());
        assertEquals(List.of(), config.accountIds());
    }

    @Test
    void testValuesFromParameters() {
        Map<String, Object> params = Map.of(
                "downloadConcurrency", 4,
                "interval", "1d",
                "accountList", "111111111111",
                "useS3SNS", true,
                "sqsDelete", "false",
                "sqsOwnerAccount", " 999999999999 "
        );

        SourceConfig config = SourceConfig.fromMap(params, NO_ENV::get);

        assertEquals(4, config.getDownloadConcurrency());
        assertEquals("1d", config.getInterval());
        assertTrue(config.isUseS3Sns());
        assertFalse(config.isSqsDelete());
        assertEquals("999999999999", config.getSqsOwnerAccount());
    }

    @Test
    void testEnvironmentFallback() {
        // Given: Only the environment sets the concurrency and interval
        Map<String, String> env = Map.of("DOWNLOAD_CONCURRENCY", "8", "INTERVAL", "2h");

        // When: Parameters override one of them
        SourceConfig config = SourceConfig.fromMap(Map.of("interval", "1d"), env::get);

        // Then: Parameters win, the environment fills the rest
        assertEquals(8, config.getDownloadConcurrency());
        assertEquals("1d", config.getInterval());
    }

    @Test
    void testNonNumericConcurrencyIsRejected() {
        SourceException e = assertThrows(SourceException.class,
                () -> SourceConfig.fromMap(Map.of("downloadConcurrency", "many"), NO_ENV::get));

        assertEquals(SourceException.Kind.BAD_CONFIGURATION, e.getKind());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void testNonPositiveConcurrencyIsRejected(int concurrency) {
        SourceConfig config = SourceConfig.builder().downloadConcurrency(concurrency).build();

        SourceException e = assertThrows(SourceException.class, config::requirePositiveConcurrency);
        assertEquals(SourceException.Kind.BAD_CONFIGURATION, e.getKind());
        assertTrue(e.getMessage().startsWith("config: bad configuration:"));
    }

    @Test
    void testAccountListIsTrimmed() {
        SourceConfig config = SourceConfig.builder().accountList("111111111111, 222222222222 ,333333333333").build();

        assertEquals(List.of("111111111111", "222222222222", "333333333333"), config.accountIds());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "12345", "111111111111;222222222222", "abcdefghijkl", "1111111111112",
            "111111111111222222222222", "111111111111 222222222222", ",111111111111"
    })
    void testMalformedAccountListIsRejected(String accountList) {
        SourceConfig config = SourceConfig.builder().accountList(accountList).build();

        SourceException e = assertThrows(SourceException.class, config::accountIds);
        assertEquals(SourceException.Kind.BAD_CONFIGURATION, e.getKind());
        assertTrue(e.getMessage().contains("invalid account list"));
    }
}
